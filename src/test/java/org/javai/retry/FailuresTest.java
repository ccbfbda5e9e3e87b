package org.javai.retry;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

class FailuresTest {

    static class HttpException extends Exception {
        private final int status;

        HttpException(int status) {
            super("HTTP " + status);
            this.status = status;
        }

        public int getStatus() {
            return status;
        }
    }

    static class RecordLikeException extends RuntimeException {
        private final String reason;

        RecordLikeException(String reason) {
            this.reason = reason;
        }

        public String reason() {
            return reason;
        }
    }

    static class NullCodeException extends Exception {
        private final String code = null;
    }

    static class MaskedCodeException extends Exception {
        private final String code = "private";

        public String getCode() {
            return "public";
        }
    }

    static class BrokenClassifiable extends Exception implements Classifiable {
        @Override
        public Optional<String> code() {
            return null;
        }
    }

    @Test
    void field_readsPrivateFieldWithoutAccessor() {
        assertThat(Failures.field(new CodedException(7), "code")).contains(7);
    }

    @Test
    void field_prefersGetter() {
        assertThat(Failures.field(new HttpException(503), "status")).contains(503);
    }

    @Test
    void field_readsRecordStyleAccessor() {
        assertThat(Failures.field(new RecordLikeException("throttled"), "reason")).contains("throttled");
    }

    @Test
    void field_missing_returnsEmpty() {
        assertThat(Failures.field(new IOException("disk"), "code")).isEmpty();
        assertThat(Failures.field(new IOException("disk"), "code", "none")).isEqualTo("none");
    }

    @Test
    void field_nullValue_returnsEmpty() {
        assertThat(Failures.field(new NullCodeException(), "code")).isEmpty();
    }

    @Test
    void field_nullFailureOrBlankName_returnsEmpty() {
        assertThat(Failures.field(null, "code")).isEmpty();
        assertThat(Failures.field(new CodedException(1), " ")).isEmpty();
    }

    @Test
    void field_jdkGetter_isReadable() {
        assertThat(Failures.field(new IOException("disk full"), "message")).contains("disk full");
    }

    @Test
    void field_unopenedJdkField_returnsEmpty() {
        assertThat(Failures.field(new IOException("disk full"), "detailMessage")).isEmpty();
    }

    @Test
    void field_accessorWinsOverSameNamedField() {
        assertThat(Failures.field(new MaskedCodeException(), "code")).contains("public");
    }

    @Test
    void code_prefersClassifiable() {
        assertThat(Failures.code(new ServiceException("NoSuchKey", "missing"))).contains("NoSuchKey");
        assertThat(Failures.code(new ServiceException(null, "no code"))).isEmpty();
        assertThat(Failures.code(new BrokenClassifiable())).isEmpty();
    }

    @Test
    void code_rendersFieldValueAsString() {
        assertThat(Failures.code(new CodedException(404))).contains("404");
        assertThat(Failures.code(new IllegalStateException())).isEmpty();
    }
}
