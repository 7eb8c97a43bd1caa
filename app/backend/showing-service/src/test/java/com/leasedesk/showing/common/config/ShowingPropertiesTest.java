package com.leasedesk.showing.common.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Startup validation of the showing settings
 */
@DisplayName("ShowingProperties validation test")
class ShowingPropertiesTest {

    private static final String[] REQUIRED = {
            "showing.search.url=http://search.local/find",
            "showing.appfolio.auth-header=Basic abc",
            "showing.appfolio.developer-id=dev-1",
            "showing.supabase.project-id=proj",
            "showing.supabase.api-key=key",
            "showing.agents.PD1.id=a-1",
            "showing.agents.PD1.name=Gracie",
            "showing.agents.PD1.email=gracie@ltrealestateco.com"
    };

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(ShowingConfig.class);

    @Test
    @DisplayName("All required values present - context starts")
    void requiredValuesPresent() {
        contextRunner.withPropertyValues(REQUIRED)
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    assertThat(context.getBean(ShowingProperties.class).getOpenai().isEnabled()).isFalse();
                });
    }

    @Test
    @DisplayName("Missing AppFolio credentials - startup fails naming the variable")
    void missingAppFolioHeader() {
        contextRunner.withPropertyValues(REQUIRED)
                .withPropertyValues("showing.appfolio.auth-header=")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure())
                            .hasStackTraceContaining("APPFOLIO_AUTH_HEADER must be configured");
                });
    }

    @Test
    @DisplayName("No agents configured - startup fails")
    void missingAgents() {
        contextRunner.withPropertyValues(
                        "showing.search.url=http://search.local/find",
                        "showing.appfolio.auth-header=Basic abc",
                        "showing.appfolio.developer-id=dev-1",
                        "showing.supabase.project-id=proj",
                        "showing.supabase.api-key=key")
                .run(context -> assertThat(context).hasFailed());
    }
}
