package dev.hirematch.config;

import dev.hirematch.taxonomy.SkillTaxonomy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Builds the process-wide skill taxonomy and the clock used for open-ended date ranges.
 */
@Slf4j
@Configuration
public class TaxonomyConfig {

    @Bean
    public SkillTaxonomy skillTaxonomy(SkillsConfig skillsConfig) {
        try {
            SkillTaxonomy taxonomy = SkillTaxonomy.from(skillsConfig);
            log.info("Loaded skill taxonomy: {} categories, {} canonical skills",
                    taxonomy.categories().size(), taxonomy.size());
            return taxonomy;
        } catch (IllegalStateException e) {
            log.error("Invalid skill taxonomy configuration: {}", e.getMessage());
            throw e;
        }
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
