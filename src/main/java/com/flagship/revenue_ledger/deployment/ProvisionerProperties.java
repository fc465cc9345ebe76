package com.flagship.revenue_ledger.deployment;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * External provisioning command.
 *
 * {@code command} is the executable plus fixed arguments, e.g.
 * {@code [node, scripts/deploy.js]}; the orchestrator appends
 * {@code --owner --payees --shares --cap}.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "revenue-ledger.provisioner")
public class ProvisionerProperties {

    @NotEmpty
    private List<String> command = new ArrayList<>();

    @NotNull
    private Duration timeout = Duration.ofSeconds(120);

    /**
     * A PENDING record older than this is treated as an abandoned attempt.
     */
    @NotNull
    private Duration pendingStaleAfter = Duration.ofMinutes(10);

    private String workingDirectory;
}
