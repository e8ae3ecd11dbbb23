package com.foliogate.config;

import com.foliogate.config.GovernanceProperties.FailurePolicy;
import com.foliogate.config.GovernanceProperties.LedgerMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationListener;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(GovernanceProperties.class)
public class GovernanceConfig implements ApplicationListener<ApplicationReadyEvent> {

    private static final Logger logger = LoggerFactory.getLogger(GovernanceConfig.class);

    private final GovernanceProperties governanceProperties;

    public GovernanceConfig(GovernanceProperties governanceProperties) {
        this.governanceProperties = governanceProperties;
    }

    @Override
    public void onApplicationEvent(ApplicationReadyEvent event) {
        governanceProperties.getClasses().forEach((name, policy) -> {
            logger.info("Operation class {}: ceiling={}, window={}, failurePolicy={}, ledgerMode={}, billed={}",
                    name, policy.getCeiling(), policy.getWindow(), policy.getFailurePolicy(),
                    policy.getLedgerMode(), policy.isBilled());
            if (policy.isBilled() && (policy.getFailurePolicy() == FailurePolicy.FAIL_OPEN
                    || policy.getLedgerMode() == LedgerMode.ASYNC)) {
                logger.warn("Billed operation class {} is not fail-closed with a blocking ledger; "
                        + "usage may go uncounted during outages", name);
            }
        });
        // The general class is checked on every invocation, so it must be configured.
        governanceProperties.policyFor(governanceProperties.getGeneralClass());
    }
}
