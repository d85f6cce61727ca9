package io.github.nabilcarel.oapivalidator.service;

import io.github.nabilcarel.oapivalidator.exception.OpenApiSpecLoadException;
import io.github.nabilcarel.oapivalidator.model.OpenApiSpecification;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.parser.OpenAPIV3Parser;
import io.swagger.v3.parser.core.models.ParseOptions;
import io.swagger.v3.parser.core.models.SwaggerParseResult;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

/**
 * Reads and parses an OpenAPI 3 document. Any problem surfaces as an
 * {@link OpenApiSpecLoadException} so that the application can refuse to start.
 */
@Slf4j
@RequiredArgsConstructor
public class OpenApiSpecificationLoader {
    private static final String INLINE_LOCATION = "inline";

    private final ResourceLoader resourceLoader;

    public OpenApiSpecificationLoader() {
        this(new DefaultResourceLoader());
    }

    /**
     * @param location a Spring resource location, e.g. {@code classpath:openapi.yaml}
     */
    public OpenApiSpecification load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new OpenApiSpecLoadException("OpenAPI specification not found: " + location, location);
        }

        String content;
        try (InputStream inputStream = resource.getInputStream()) {
            content = new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new OpenApiSpecLoadException("Failed to read OpenAPI specification: " + location, location, e);
        }

        return parse(content, location);
    }

    public OpenApiSpecification parse(String content) {
        return parse(content, INLINE_LOCATION);
    }

    private OpenApiSpecification parse(String content, String location) {
        log.info("Loading OpenAPI specification from {}", location);

        ParseOptions parseOptions = new ParseOptions();
        parseOptions.setResolve(true);
        SwaggerParseResult result = new OpenAPIV3Parser().readContents(content, null, parseOptions);

        List<String> messages = result != null && result.getMessages() != null ? result.getMessages() : List.of();
        OpenAPI openApi = result != null ? result.getOpenAPI() : null;

        if (openApi == null || openApi.getOpenapi() == null || !openApi.getOpenapi().startsWith("3.")) {
            throw new OpenApiSpecLoadException(
                    "Invalid OpenAPI 3 specification " + location + ": " + messages, location);
        }

        messages.forEach(message -> log.warn("OpenAPI specification {}: {}", location, message));

        OpenApiSpecification specification = new OpenApiSpecification(openApi, content, location);
        log.info("Loaded OpenAPI specification '{}' version {} with {} operations",
                specification.getTitle(), specification.getVersion(), specification.getOperationCount());
        return specification;
    }
}
