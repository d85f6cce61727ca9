package io.github.nabilcarel.oapivalidator;

import static org.assertj.core.api.Assertions.assertThat;

import io.github.nabilcarel.oapivalidator.autoconfigure.OapiValidatorAutoConfiguration;
import io.github.nabilcarel.oapivalidator.autoconfigure.OapiValidatorHealthIndicator;
import io.github.nabilcarel.oapivalidator.config.filter.OapiRequestValidatorFilter;
import io.github.nabilcarel.oapivalidator.exception.OpenApiSpecLoadException;
import io.github.nabilcarel.oapivalidator.model.ErrorResponseContentType;
import io.github.nabilcarel.oapivalidator.model.ValidationOptions;
import io.github.nabilcarel.oapivalidator.service.AuthenticationFunction;
import io.github.nabilcarel.oapivalidator.service.CredentialPresenceAuthenticationFunction;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.WebApplicationContextRunner;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.core.Ordered;

class OapiValidatorAutoConfigurationTest {

    private final WebApplicationContextRunner contextRunner =
            new WebApplicationContextRunner()
                    .withConfiguration(AutoConfigurations.of(OapiValidatorAutoConfiguration.class));

    @Test
    void filterRegisteredWhenSpecLocationConfigured() {
        contextRunner
                .withPropertyValues("oapi.validator.spec-location=classpath:petstore.yaml")
                .run(context -> {
                    assertThat(context).hasSingleBean(OapiRequestValidatorFilter.class);
                    assertThat(context).hasSingleBean(FilterRegistrationBean.class);

                    FilterRegistrationBean<?> registration = context.getBean(FilterRegistrationBean.class);
                    assertThat(registration.getUrlPatterns()).containsExactly("/*");
                    assertThat(registration.getOrder()).isEqualTo(Ordered.LOWEST_PRECEDENCE - 1);

                    ValidationOptions options = context.getBean(ValidationOptions.class);
                    assertThat(options.isMultiError()).isFalse();
                    assertThat(options.getErrorResponseContentType()).isEqualTo(ErrorResponseContentType.PLAIN);
                    assertThat(options.getAuthenticationFunction())
                            .isInstanceOf(CredentialPresenceAuthenticationFunction.class);
                });
    }

    @Test
    void propertiesBoundToOptionsAndRegistration() {
        contextRunner
                .withPropertyValues(
                        "oapi.validator.spec-location=classpath:petstore.yaml",
                        "oapi.validator.url-patterns=/api/*,/v2/*",
                        "oapi.validator.filter-order=5",
                        "oapi.validator.multi-error=true",
                        "oapi.validator.exclude-request-body=true",
                        "oapi.validator.error-response-content-type=json")
                .run(context -> {
                    FilterRegistrationBean<?> registration = context.getBean(FilterRegistrationBean.class);
                    assertThat(registration.getUrlPatterns()).containsExactly("/api/*", "/v2/*");
                    assertThat(registration.getOrder()).isEqualTo(5);

                    ValidationOptions options = context.getBean(ValidationOptions.class);
                    assertThat(options.isMultiError()).isTrue();
                    assertThat(options.isExcludeRequestBody()).isTrue();
                    assertThat(options.getErrorResponseContentType()).isEqualTo(ErrorResponseContentType.JSON);
                });
    }

    @Test
    void applicationAuthenticationFunctionIsUsed() {
        AuthenticationFunction custom = input -> { };

        contextRunner
                .withPropertyValues("oapi.validator.spec-location=classpath:petstore.yaml")
                .withBean(AuthenticationFunction.class, () -> custom)
                .run(context -> assertThat(context.getBean(ValidationOptions.class).getAuthenticationFunction())
                        .isSameAs(custom));
    }

    @Test
    void healthIndicatorReportsSpecification() {
        contextRunner
                .withPropertyValues("oapi.validator.spec-location=classpath:petstore.yaml")
                .run(context -> {
                    Health health = context.getBean(OapiValidatorHealthIndicator.class).health();
                    assertThat(health.getStatus()).isEqualTo(Status.UP);
                    assertThat(health.getDetails())
                            .containsEntry("title", "Petstore")
                            .containsEntry("version", "1.0.0")
                            .containsEntry("operations", 5);
                });
    }

    @Test
    void backsOffWhenDisabled() {
        contextRunner
                .withPropertyValues(
                        "oapi.validator.enabled=false",
                        "oapi.validator.spec-location=classpath:petstore.yaml")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(OapiRequestValidatorFilter.class);
                    assertThat(context).doesNotHaveBean(FilterRegistrationBean.class);
                });
    }

    @Test
    void failsStartupWhenSpecificationIsMissing() {
        contextRunner
                .withPropertyValues("oapi.validator.spec-location=classpath:does-not-exist.yaml")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure()).hasRootCauseInstanceOf(OpenApiSpecLoadException.class);
                });
    }

    @Test
    void failsStartupWithoutSpecLocation() {
        contextRunner.run(context -> assertThat(context).hasFailed());
    }
}
