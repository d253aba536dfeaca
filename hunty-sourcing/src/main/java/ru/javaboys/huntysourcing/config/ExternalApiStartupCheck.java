package ru.javaboys.huntysourcing.config;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import ru.javaboys.huntysourcing.engine.company.CompanyDirectory;

/**
 * Reports on startup which external lookups are usable.
 * Missing keys do not stop the application: search and email lookups then fail closed.
 * An empty company directory does, since domain resolution would silently never work.
 */
@Slf4j
@Component
public class ExternalApiStartupCheck {

    private final CompanyDirectory companyDirectory;
    private final String serpApiKey;
    private final String hunterApiKey;

    public ExternalApiStartupCheck(CompanyDirectory companyDirectory,
                                   @Value("${hunty.search.serpapi.api-key:}") String serpApiKey,
                                   @Value("${hunty.email.hunter.api-key:}") String hunterApiKey) {
        this.companyDirectory = companyDirectory;
        this.serpApiKey = serpApiKey;
        this.hunterApiKey = hunterApiKey;
    }

    @PostConstruct
    public void verifyExternalApis() {
        if (companyDirectory.size() == 0) {
            throw new IllegalStateException("Company domain directory is empty");
        }
        if (StringUtils.isBlank(serpApiKey)) {
            log.warn("SERPAPI_KEY is not set: contact generation will return no candidates");
        } else {
            log.info("SerpAPI key configured. Startup check passed.");
        }
        if (StringUtils.isBlank(hunterApiKey)) {
            log.warn("HUNTER_API_KEY is not set: predicted emails will be N/A");
        }
    }
}
