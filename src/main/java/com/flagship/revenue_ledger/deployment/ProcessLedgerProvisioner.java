package com.flagship.revenue_ledger.deployment;

import com.flagship.revenue_ledger.common.Addresses;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Runs the configured provisioning command as an external process.
 *
 * Contract with the command:
 * - arguments {@code --owner <addr> --payees a,b --shares 6000,4000 --cap <decimal>}
 * - exactly one line on stdout: the new ledger's address
 * - diagnostics on stderr
 * - exit 0 on success, non-zero on failure
 *
 * Classification:
 * - could not start, or non-zero exit: FAILED
 * - timeout or interruption: AMBIGUOUS; the process is left running and its
 *   eventual output is logged for reconciliation
 * - exit 0 with anything but one valid address line: AMBIGUOUS
 */
@Component
@Slf4j
public class ProcessLedgerProvisioner implements LedgerProvisioner {

    private static final long DRAIN_GRACE_SECONDS = 5;

    private final ProvisionerProperties properties;
    private final ExecutorService streamExecutor;

    public ProcessLedgerProvisioner(ProvisionerProperties properties) {
        this.properties = properties;
        AtomicInteger threads = new AtomicInteger();
        this.streamExecutor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "provisioner-io-" + threads.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public ProvisioningOutcome provision(ProvisioningRequest request) {
        List<String> command = buildCommand(request);
        log.info("Starting ledger provisioner: roundId={}, payees={}, cap={}",
                request.getRoundId(), request.getPayees().size(), request.getCap());

        Process process;
        try {
            ProcessBuilder builder = new ProcessBuilder(command);
            if (properties.getWorkingDirectory() != null && !properties.getWorkingDirectory().isBlank()) {
                builder.directory(new File(properties.getWorkingDirectory()));
            }
            process = builder.start();
        } catch (IOException e) {
            log.error("Provisioner could not be started: command={}, error={}", command.get(0), e.getMessage());
            return ProvisioningOutcome.failed("provisioner could not be started: " + e.getMessage());
        }

        // Drain both streams concurrently so a chatty process cannot block on a full pipe.
        CompletableFuture<List<String>> stdout = drain(process.getInputStream());
        CompletableFuture<List<String>> stderr = drain(process.getErrorStream());

        boolean exited;
        try {
            exited = process.waitFor(properties.getTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            watchInBackground(request, process, stdout, stderr);
            return ProvisioningOutcome.ambiguous("interrupted while waiting for the provisioner");
        }

        if (!exited) {
            log.warn("Provisioner timed out after {}; leaving it running: roundId={}, pid={}",
                    properties.getTimeout(), request.getRoundId(), process.pid());
            watchInBackground(request, process, stdout, stderr);
            return ProvisioningOutcome.ambiguous("provisioner timed out after " + properties.getTimeout());
        }

        List<String> outLines;
        List<String> errLines;
        try {
            outLines = stdout.get(DRAIN_GRACE_SECONDS, TimeUnit.SECONDS);
            errLines = stderr.get(DRAIN_GRACE_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ProvisioningOutcome.ambiguous("interrupted while reading provisioner output");
        } catch (ExecutionException | TimeoutException e) {
            return process.exitValue() == 0
                    ? ProvisioningOutcome.ambiguous("provisioner output could not be read: " + e.getMessage())
                    : ProvisioningOutcome.failed("provisioner exited with " + process.exitValue()
                            + " and its output could not be read");
        }

        int exitCode = process.exitValue();
        if (exitCode != 0) {
            String diagnostic = String.join("\n", errLines);
            log.warn("Provisioner failed: roundId={}, exitCode={}, stderr={}", request.getRoundId(), exitCode, diagnostic);
            return ProvisioningOutcome.failed(String.format("provisioner exited with %d: %s", exitCode, diagnostic));
        }

        return parseOutput(outLines);
    }

    /**
     * Applies the one-line stdout contract to the output of a successful run.
     * Lines arrive without their terminators, so a single trailing newline is
     * already accounted for; blank lines and padding around the address are not
     * part of the contract.
     */
    static ProvisioningOutcome parseOutput(List<String> outLines) {
        if (outLines.size() != 1) {
            return ProvisioningOutcome.ambiguous(String.format(
                    "provisioner exited 0 but printed %d lines instead of one address", outLines.size()));
        }
        String address = outLines.get(0);
        if (!Addresses.isValid(address)) {
            return ProvisioningOutcome.ambiguous("provisioner exited 0 but printed a malformed address: [" + address + "]");
        }
        return ProvisioningOutcome.succeeded(Addresses.normalize("ledger", address));
    }

    List<String> buildCommand(ProvisioningRequest request) {
        List<String> command = new ArrayList<>(properties.getCommand());
        command.add("--owner");
        command.add(request.getOwner());
        command.add("--payees");
        command.add(String.join(",", request.getPayees()));
        command.add("--shares");
        command.add(request.getShares().stream().map(String::valueOf).collect(Collectors.joining(",")));
        command.add("--cap");
        command.add(request.getCap());
        return command;
    }

    private CompletableFuture<List<String>> drain(InputStream stream) {
        return CompletableFuture.supplyAsync(() -> {
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
                List<String> lines = new ArrayList<>();
                String line;
                while ((line = reader.readLine()) != null) {
                    lines.add(line);
                }
                return lines;
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }, streamExecutor);
    }

    /**
     * Logs the eventual result of an abandoned run so an operator can reconcile it.
     */
    private void watchInBackground(ProvisioningRequest request, Process process,
                                   CompletableFuture<List<String>> stdout,
                                   CompletableFuture<List<String>> stderr) {
        process.onExit()
                .thenCombine(stdout.thenCombine(stderr, List::of), (finished, output) -> {
                    log.warn("Abandoned provisioner finished: roundId={}, exitCode={}, stdout=[{}], stderr=[{}]",
                            request.getRoundId(), finished.exitValue(),
                            String.join(" | ", output.get(0)), String.join(" | ", output.get(1)));
                    return finished;
                })
                .exceptionally(e -> {
                    log.error("Lost track of abandoned provisioner: roundId={}, error={}",
                            request.getRoundId(), e.getMessage());
                    return null;
                });
    }

    @PreDestroy
    public void shutdown() {
        streamExecutor.shutdown();
    }
}
