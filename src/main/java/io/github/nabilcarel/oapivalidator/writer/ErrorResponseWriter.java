package io.github.nabilcarel.oapivalidator.writer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import io.github.nabilcarel.oapivalidator.model.ErrorResponseContentType;
import io.github.nabilcarel.oapivalidator.model.ValidationError;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Writes the status, headers and body of a rejected request. The body is the error message as
 * plain text, a JSON string or an XML {@code <string>} element, followed by a newline.
 */
@RequiredArgsConstructor
public class ErrorResponseWriter {
    public static final String CONTENT_TYPE_OPTIONS_HEADER = "X-Content-Type-Options";
    private static final String XML_ROOT_NAME = "string";

    private final ObjectMapper objectMapper;
    private final XmlMapper xmlMapper;
    @Getter
    private final ErrorResponseContentType contentType;

    public ErrorResponseWriter(ErrorResponseContentType contentType) {
        this(new ObjectMapper(), new XmlMapper(), contentType);
    }

    public void write(HttpServletResponse response, ValidationError error) throws IOException {
        byte[] body = (encode(error.getMessage()) + "\n").getBytes(StandardCharsets.UTF_8);

        response.setContentType(contentType.headerValue());
        response.setHeader(CONTENT_TYPE_OPTIONS_HEADER, "nosniff");
        response.setStatus(error.getStatus().value());
        response.setContentLength(body.length);
        response.getOutputStream().write(body);
        response.flushBuffer();
    }

    String encode(String message) throws JsonProcessingException {
        return switch (contentType) {
            case JSON -> objectMapper.writeValueAsString(message);
            case XML -> xmlMapper.writer().withRootName(XML_ROOT_NAME).writeValueAsString(message);
            case PLAIN -> message;
        };
    }
}
