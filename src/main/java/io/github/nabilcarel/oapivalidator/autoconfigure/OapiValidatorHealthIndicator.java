package io.github.nabilcarel.oapivalidator.autoconfigure;

import io.github.nabilcarel.oapivalidator.model.OpenApiSpecification;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

@RequiredArgsConstructor
public class OapiValidatorHealthIndicator implements HealthIndicator {
    private final OpenApiSpecification specification;

    public Health health() {
        Health.Builder builder = Health.up()
                .withDetail("location", specification.getLocation())
                .withDetail("operations", specification.getOperationCount());

        if (specification.getTitle() != null) {
            builder.withDetail("title", specification.getTitle());
        }
        if (specification.getVersion() != null) {
            builder.withDetail("version", specification.getVersion());
        }

        return builder.build();
    }
}
