package io.github.nabilcarel.oapivalidator;

import io.github.nabilcarel.oapivalidator.model.ErrorKind;
import io.github.nabilcarel.oapivalidator.model.ErrorResponseContentType;
import io.github.nabilcarel.oapivalidator.model.ValidationError;
import io.github.nabilcarel.oapivalidator.writer.ErrorResponseWriter;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.assertj.core.api.Assertions.*;

class ErrorResponseWriterTest {

    private final ValidationError routeError =
            new ValidationError(ErrorKind.ROUTE_NOT_FOUND, "no matching operation was found");

    @Test
    void testWrite_plainTextByDefault() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();

        new ErrorResponseWriter(ErrorResponseContentType.PLAIN).write(response, routeError);

        assertThat(response.getStatus()).isEqualTo(400);
        assertContentType(response, MediaType.TEXT_PLAIN);
        assertThat(response.getHeader("X-Content-Type-Options")).isEqualTo("nosniff");
        assertThat(response.getContentAsString()).isEqualTo("no matching operation was found\n");
    }

    @Test
    void testWrite_jsonString() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();
        ValidationError error = new ValidationError(ErrorKind.SECURITY_REQUIREMENT_FAILED,
                "security requirements failed: missing \"X-API-Key\"");

        new ErrorResponseWriter(ErrorResponseContentType.JSON).write(response, error);

        assertThat(response.getStatus()).isEqualTo(401);
        assertContentType(response, MediaType.APPLICATION_JSON);
        assertThat(response.getHeader("X-Content-Type-Options")).isEqualTo("nosniff");
        assertThat(response.getContentAsString())
                .isEqualTo("\"security requirements failed: missing \\\"X-API-Key\\\"\"\n");
    }

    @Test
    void testWrite_xmlString() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();
        ValidationError error = new ValidationError(ErrorKind.VALIDATION_FAILED,
                "error validating route: a & b");

        new ErrorResponseWriter(ErrorResponseContentType.XML).write(response, error);

        assertThat(response.getStatus()).isEqualTo(500);
        assertContentType(response, MediaType.APPLICATION_XML);
        assertThat(response.getContentAsString())
                .isEqualTo("<string>error validating route: a &amp; b</string>\n");
    }

    @Test
    void testWrite_utf8Body() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();
        ValidationError error = new ValidationError(ErrorKind.REQUEST_CONFORMANCE_FAILED, "nom invalide: é");

        new ErrorResponseWriter(ErrorResponseContentType.PLAIN).write(response, error);

        assertThat(response.getContentAsByteArray())
                .isEqualTo("nom invalide: é\n".getBytes(StandardCharsets.UTF_8));
    }

    private void assertContentType(MockHttpServletResponse response, MediaType expected) {
        MediaType contentType = MediaType.parseMediaType(response.getContentType());
        assertThat(contentType.isCompatibleWith(expected)).isTrue();
        assertThat(contentType.getCharset()).isEqualTo(StandardCharsets.UTF_8);
    }
}
