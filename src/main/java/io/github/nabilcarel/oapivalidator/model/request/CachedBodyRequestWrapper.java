package io.github.nabilcarel.oapivalidator.model.request;

import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.net.URLEncoder;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import io.github.nabilcarel.oapivalidator.util.RequestPaths;
import jakarta.servlet.ReadListener;
import jakarta.servlet.ServletInputStream;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletRequestWrapper;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.util.MultiValueMap;

/**
 * Buffers the request body so it can be read by the validator and again by the next handler.
 *
 * <p>Form posts and multipart requests are left to the container so parameters and parts stay
 * available downstream. A form body is rebuilt from the parameter map and a multipart body is not
 * read at all.
 */
public class CachedBodyRequestWrapper extends HttpServletRequestWrapper {
    /** {@code null} when the stream belongs to the container. */
    private final byte[] bodyBytes;
    private final boolean formPost;

    public CachedBodyRequestWrapper(HttpServletRequest request) throws IOException {
        super(request);
        this.formPost = isFormPost(request);
        this.bodyBytes = formPost || isMultipart(request) ? null : request.getInputStream().readAllBytes();
    }

    @Override
    public ServletInputStream getInputStream() throws IOException {
        if (bodyBytes == null) {
            return super.getInputStream();
        }
        ByteArrayInputStream byteStream = new ByteArrayInputStream(bodyBytes);
        return new ServletInputStream() {

            @Override
            public int read() throws IOException {
                return byteStream.read();
            }

            @Override
            public boolean isFinished() {
                return byteStream.available() == 0;
            }

            @Override
            public boolean isReady() {
                return true;
            }

            @Override
            public void setReadListener(ReadListener readListener) {
                throw new UnsupportedOperationException();
            }
        };
    }

    @Override
    public BufferedReader getReader() throws IOException {
        if (bodyBytes == null) {
            return super.getReader();
        }
        return new BufferedReader(new InputStreamReader(getInputStream(), getBodyCharset()));
    }

    /**
     * The body as the validator sees it, or {@code null} when it is not available.
     */
    public String getBody() {
        if (formPost) {
            return encodeFormParameters();
        }
        return bodyBytes != null ? new String(bodyBytes, getBodyCharset()) : null;
    }

    public boolean hasBody() {
        String body = getBody();
        return body != null && !body.isEmpty();
    }

    /**
     * Whether the body could be inspected. Multipart bodies cannot.
     */
    public boolean isBodyAvailable() {
        return bodyBytes != null || formPost;
    }

    private static boolean isFormPost(HttpServletRequest request) {
        String contentType = request.getContentType();
        return contentType != null
                && contentType.contains(MediaType.APPLICATION_FORM_URLENCODED_VALUE)
                && HttpMethod.POST.matches(request.getMethod());
    }

    private static boolean isMultipart(HttpServletRequest request) {
        String contentType = request.getContentType();
        return contentType != null && contentType.toLowerCase(Locale.ROOT).startsWith("multipart/");
    }

    private String encodeFormParameters() {
        Charset charset = getBodyCharset();
        MultiValueMap<String, String> queryParams = RequestPaths.queryParams(this);
        StringBuilder body = new StringBuilder();

        for (Map.Entry<String, String[]> entry : getParameterMap().entrySet()) {
            // The parameter map merges the query string in; keep only what came from the body
            List<String> values = new ArrayList<>(Arrays.asList(entry.getValue()));
            List<String> fromQuery = queryParams.get(entry.getKey());
            if (fromQuery != null) {
                fromQuery.forEach(values::remove);
            }

            for (String value : values) {
                if (body.length() > 0) {
                    body.append('&');
                }
                body.append(URLEncoder.encode(entry.getKey(), charset));
                body.append('=');
                body.append(URLEncoder.encode(value, charset));
            }
        }
        return body.toString();
    }

    private Charset getBodyCharset() {
        String encoding = getCharacterEncoding();
        return encoding != null ? Charset.forName(encoding) : StandardCharsets.UTF_8;
    }
}
