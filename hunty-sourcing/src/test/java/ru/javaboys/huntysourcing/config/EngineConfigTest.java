package ru.javaboys.huntysourcing.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.ClassPathResource;
import ru.javaboys.huntysourcing.engine.company.CompanyDirectory;
import ru.javaboys.huntysourcing.engine.company.CompanyMatcher;
import ru.javaboys.huntysourcing.engine.company.CompanyNameRules;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EngineConfigTest {

    private final EngineConfig config = new EngineConfig();

    @Test
    void companyDirectory_shouldLoadBundledDomains() {
        CompanyDirectory directory = config.companyDirectory(new ObjectMapper(), new ClassPathResource("company-domains.json"));

        assertThat(directory.size()).isGreaterThan(50);
        assertThat(directory.get("goldman sachs")).isEqualTo("gs.com");
        assertThat(directory.get("jpmorgan chase")).isEqualTo("jpmorgan.com");
    }

    @Test
    void companyDirectory_shouldResolveCommonAliases() {
        CompanyDirectory directory = config.companyDirectory(new ObjectMapper(), new ClassPathResource("company-domains.json"));
        CompanyMatcher matcher = new CompanyMatcher(CompanyNameRules.defaults(), directory);

        assertThat(matcher.resolveDomain("J.P. Morgan")).hasValueSatisfying(m -> assertThat(m.getDomain()).isEqualTo("jpmorgan.com"));
        assertThat(matcher.resolveDomain("Houlihan Lokey Inc.")).hasValueSatisfying(m -> assertThat(m.getDomain()).isEqualTo("hl.com"));
    }

    @Test
    void companyDirectory_shouldFailOnBrokenFile() {
        ByteArrayResource broken = new ByteArrayResource("not json".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> config.companyDirectory(new ObjectMapper(), broken))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void startupCheck_shouldRejectEmptyDirectory() {
        ExternalApiStartupCheck check = new ExternalApiStartupCheck(CompanyDirectory.empty(), "serp", "hunter");

        assertThatThrownBy(check::verifyExternalApis).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void startupCheck_shouldOnlyWarnAboutMissingKeys() {
        CompanyDirectory directory = config.companyDirectory(new ObjectMapper(), new ClassPathResource("company-domains.json"));

        assertThatCode(() -> new ExternalApiStartupCheck(directory, "", "").verifyExternalApis())
                .doesNotThrowAnyException();
    }
}
