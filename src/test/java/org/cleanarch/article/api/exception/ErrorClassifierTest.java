package org.cleanarch.article.api.exception;

import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.cleanarch.article.api.dto.ArticleRequest;
import org.cleanarch.article.domain.exception.DomainError;
import org.cleanarch.article.domain.exception.DomainException;
import org.cleanarch.article.service.RequestDeadlineExceededException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.TypeMismatchException;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpHeaders;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.mock.http.MockHttpInputMessage;
import org.springframework.validation.BeanPropertyBindingResult;
import org.springframework.validation.BindException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingPathVariableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.servlet.NoHandlerFoundException;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ErrorClassifier.
 */
class ErrorClassifierTest {

    private final ErrorClassifier classifier = new ErrorClassifier();

    // --- Application errors ---

    @Test
    void shouldUseAppErrorVerbatim() {
        ErrorClassification result = classifier.classify(AppError.withDetails(404, "not found", "id=7"));

        assertEquals(ErrorClassification.Kind.APPLICATION, result.kind());
        assertEquals(404, result.code());
        assertEquals("not found", result.message());
        assertEquals("id=7", result.details());
        assertEquals(Severity.WARN, result.severity());
    }

    @Test
    void shouldReportErrorSeverityForServerSideAppErrors() {
        assertEquals(Severity.ERROR, classifier.classify(AppError.INTERNAL_SERVER_ERROR).severity());
        assertEquals(Severity.ERROR, classifier.classify(AppError.withDetails(503, "down", null)).severity());
        assertEquals(Severity.WARN, classifier.classify(AppError.withDetails(499, "closed", null)).severity());
        assertEquals(Severity.WARN, classifier.classify(AppError.BAD_REQUEST).severity());
    }

    @Test
    void shouldFindAppErrorInCauseChain() {
        RuntimeException wrapper = new RuntimeException("wrapped", AppError.CONFLICT);

        ErrorClassification result = classifier.classify(wrapper);

        assertEquals(409, result.code());
        assertEquals("资源冲突", result.message());
    }

    @Test
    void appErrorShouldWinOverWrappedDomainError() {
        AppError error = AppError.withCause(404, "获取文章失败", new DomainException(DomainError.NOT_FOUND));

        ErrorClassification result = classifier.classify(error);

        assertEquals(ErrorClassification.Kind.APPLICATION, result.kind());
        assertEquals("获取文章失败", result.message());
        assertNull(result.details());
    }

    // --- Binding failures ---

    @Test
    void shouldClassifyUnreadableBodyAsBadRequestWithRawMessage() {
        HttpMessageNotReadableException ex = new HttpMessageNotReadableException(
                "JSON parse error: Unrecognized token 'invalid'", new MockHttpInputMessage(new byte[0]));

        ErrorClassification result = classifier.classify(ex);

        assertEquals(ErrorClassification.Kind.BINDING, result.kind());
        assertEquals(400, result.code());
        assertEquals("请求参数错误", result.message());
        assertEquals("JSON parse error: Unrecognized token 'invalid'", result.details());
        assertEquals(Severity.WARN, result.severity());
    }

    @Test
    void shouldJoinFieldErrorsForBindException() {
        BeanPropertyBindingResult bindingResult = new BeanPropertyBindingResult(new ArticleRequest(), "articleRequest");
        bindingResult.addError(new FieldError("articleRequest", "title", "title is required"));
        bindingResult.addError(new FieldError("articleRequest", "content", "content is required"));

        ErrorClassification result = classifier.classify(new BindException(bindingResult));

        assertEquals(400, result.code());
        assertEquals("title: title is required, content: content is required", result.details());
    }

    @Test
    void shouldClassifyTypeMismatchAndMissingParameterAsBinding() {
        TypeMismatchException mismatch = new TypeMismatchException("invalid", Long.class);
        MissingServletRequestParameterException missing = new MissingServletRequestParameterException("num", "int");

        assertEquals(ErrorClassification.Kind.BINDING, classifier.classify(mismatch).kind());
        assertEquals(mismatch.getMessage(), classifier.classify(mismatch).details());
        assertEquals(ErrorClassification.Kind.BINDING, classifier.classify(missing).kind());
        assertEquals(400, classifier.classify(missing).code());
    }

    @Test
    void shouldListConstraintViolationsInStableOrder() {
        Validator validator = Validation.buildDefaultValidatorFactory().getValidator();
        ConstraintViolationException ex = new ConstraintViolationException(validator.validate(new ArticleRequest()));

        ErrorClassification result = classifier.classify(ex);

        assertEquals(400, result.code());
        assertEquals("content: content is required, title: title is required", result.details());
    }

    @Test
    void shouldNotTreatMissingPathVariableAsClientError() throws NoSuchMethodException {
        MethodParameter parameter = new MethodParameter(
                ErrorClassifierTest.class.getDeclaredMethod("handlerWithId", long.class), 0);

        ErrorClassification result = classifier.classify(new MissingPathVariableException("id", parameter));

        assertEquals(ErrorClassification.Kind.FRAMEWORK, result.kind());
        assertNull(result.details());
    }

    // --- Domain errors ---

    @Test
    void shouldMapDomainErrorsToFixedStatusAndMessage() {
        ErrorClassification notFound = classifier.classify(new DomainException(DomainError.NOT_FOUND));
        ErrorClassification conflict = classifier.classify(new DomainException(DomainError.CONFLICT));
        ErrorClassification internal = classifier.classify(new DomainException(DomainError.INTERNAL_SERVER_ERROR));
        ErrorClassification badParam = classifier.classify(new DomainException(DomainError.BAD_PARAM_INPUT));

        assertEquals(404, notFound.code());
        assertEquals("资源不存在", notFound.message());
        assertNull(notFound.details());
        assertEquals(Severity.WARN, notFound.severity());

        assertEquals(409, conflict.code());
        assertEquals("资源冲突", conflict.message());

        assertEquals(500, internal.code());
        assertEquals("服务器内部错误", internal.message());
        assertEquals(Severity.ERROR, internal.severity());

        assertEquals(400, badParam.code());
    }

    @Test
    void statusOfShouldCoverEveryDomainError() {
        for (DomainError error : DomainError.values()) {
            assertNotEquals(0, ErrorClassifier.statusOf(error));
        }
    }

    // --- Framework errors ---

    @Test
    void shouldKeepFrameworkStatusWithCanonicalMessage() {
        ErrorClassification noHandler = classifier.classify(new NoHandlerFoundException("GET", "/nope", new HttpHeaders()));
        ErrorClassification notAllowed = classifier.classify(new HttpRequestMethodNotSupportedException("PATCH"));

        assertEquals(404, noHandler.code());
        assertEquals("资源不存在", noHandler.message());
        assertEquals(405, notAllowed.code());
        assertEquals("请求方法不允许", notAllowed.message());
        assertNull(notAllowed.details());
    }

    // --- Unclassified failures ---

    @Test
    void shouldHideInternalTextOfOpaqueFailures() {
        ErrorClassification result = classifier.classify(
                new IllegalStateException("SELECT password FROM users WHERE id = 1"));

        assertEquals(ErrorClassification.Kind.UNCLASSIFIED, result.kind());
        assertEquals(500, result.code());
        assertEquals("服务器内部错误", result.message());
        assertNull(result.details());
        assertEquals(Severity.ERROR, result.severity());
    }

    @Test
    void shouldTreatJvmErrorsAndNullAsUnclassified() {
        assertEquals(500, classifier.classify(new AssertionError("boom")).code());
        assertEquals(500, classifier.classify(new StackOverflowError()).code());
        assertEquals(ErrorClassification.Kind.UNCLASSIFIED, classifier.classify(null).kind());
    }

    @Test
    void shouldTreatExpiredDeadlineAsOpaqueFailure() {
        ErrorClassification result = classifier.classify(
                new RequestDeadlineExceededException("fetch", Instant.EPOCH));

        assertEquals(500, result.code());
        assertNull(result.details());
    }

    @Test
    void shouldSurviveCyclicCauseChain() {
        RuntimeException first = new RuntimeException("first");
        RuntimeException second = new RuntimeException("second", first);
        first.initCause(second);

        assertEquals(500, classifier.classify(first).code());
    }

    @SuppressWarnings("unused")
    private void handlerWithId(long id) {
    }
}
