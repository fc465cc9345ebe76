package com.flagship.revenue_ledger.deployment;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class ProcessLedgerProvisionerTest {

    private static final String ADDRESS = "0x00000000000000000000000000000000000000Ff";

    private static final ProvisioningRequest REQUEST = new ProvisioningRequest(UUID.randomUUID(),
            "0x00000000000000000000000000000000000000ad",
            List.of("0x000000000000000000000000000000000000000a", "0x000000000000000000000000000000000000000b"),
            List.of(6000, 4000), "6");

    private final List<ProcessLedgerProvisioner> started = new ArrayList<>();

    @AfterEach
    void tearDown() {
        started.forEach(ProcessLedgerProvisioner::shutdown);
    }

    private ProcessLedgerProvisioner provisioner(String script, Duration timeout) {
        ProvisionerProperties properties = new ProvisionerProperties();
        // The script sees the appended arguments as $1.. after "sh"
        properties.setCommand(List.of("/bin/sh", "-c", script, "sh"));
        properties.setTimeout(timeout);
        ProcessLedgerProvisioner provisioner = new ProcessLedgerProvisioner(properties);
        started.add(provisioner);
        return provisioner;
    }

    @Nested
    @DisplayName("Output contract")
    class OutputContract {

        @Test
        @DisplayName("One valid address line succeeds and is normalized")
        void parseOutput_SingleAddress() {
            ProvisioningOutcome outcome = ProcessLedgerProvisioner.parseOutput(List.of(ADDRESS));

            assertEquals(ProvisioningOutcome.Kind.SUCCEEDED, outcome.getKind());
            assertEquals(ADDRESS.toLowerCase(), outcome.getLedgerAddress());
        }

        @Test
        @DisplayName("No output, several lines or a malformed address are ambiguous")
        void parseOutput_Ambiguous() {
            assertEquals(ProvisioningOutcome.Kind.AMBIGUOUS,
                    ProcessLedgerProvisioner.parseOutput(List.of()).getKind());
            assertEquals(ProvisioningOutcome.Kind.AMBIGUOUS,
                    ProcessLedgerProvisioner.parseOutput(List.of("compiling...", ADDRESS)).getKind());
            assertEquals(ProvisioningOutcome.Kind.AMBIGUOUS,
                    ProcessLedgerProvisioner.parseOutput(List.of("0x1234")).getKind());
        }

        @Test
        @DisplayName("Blank lines or padding around the address break the one-line contract")
        void parseOutput_PaddedOutputAmbiguous() {
            assertEquals(ProvisioningOutcome.Kind.AMBIGUOUS,
                    ProcessLedgerProvisioner.parseOutput(List.of("", "  " + ADDRESS + "  ", "")).getKind());
            assertEquals(ProvisioningOutcome.Kind.AMBIGUOUS,
                    ProcessLedgerProvisioner.parseOutput(List.of(ADDRESS, "")).getKind());
            assertEquals(ProvisioningOutcome.Kind.AMBIGUOUS,
                    ProcessLedgerProvisioner.parseOutput(List.of(" " + ADDRESS)).getKind());
        }

        @Test
        @DisplayName("Arguments are appended after the configured command")
        void buildCommand_AppendsArguments() {
            List<String> command = provisioner("true", Duration.ofSeconds(5)).buildCommand(REQUEST);

            assertEquals(List.of("/bin/sh", "-c", "true", "sh",
                    "--owner", "0x00000000000000000000000000000000000000ad",
                    "--payees", "0x000000000000000000000000000000000000000a,0x000000000000000000000000000000000000000b",
                    "--shares", "6000,4000",
                    "--cap", "6"), command);
        }
    }

    @Nested
    @EnabledOnOs({OS.LINUX, OS.MAC})
    @DisplayName("Running a real process")
    class RealProcess {

        @Test
        @DisplayName("Exit 0 with an address succeeds")
        void provision_Success() {
            ProvisioningOutcome outcome = provisioner(
                    "echo 'deploying' >&2; echo " + ADDRESS, Duration.ofSeconds(10)).provision(REQUEST);

            assertEquals(ProvisioningOutcome.Kind.SUCCEEDED, outcome.getKind());
            assertEquals(ADDRESS.toLowerCase(), outcome.getLedgerAddress());
        }

        @Test
        @DisplayName("The provisioner receives the share arguments")
        void provision_ReceivesArguments() {
            // Prints an address only when --shares carries the expected list
            ProvisioningOutcome outcome = provisioner(
                    "case \"$*\" in *'--shares 6000,4000'*) echo " + ADDRESS + ";; *) exit 3;; esac",
                    Duration.ofSeconds(10)).provision(REQUEST);

            assertEquals(ProvisioningOutcome.Kind.SUCCEEDED, outcome.getKind());
        }

        @Test
        @DisplayName("A non-zero exit is a clean failure carrying stderr")
        void provision_NonZeroExit() {
            ProvisioningOutcome outcome = provisioner(
                    "echo 'insufficient funds' >&2; exit 2", Duration.ofSeconds(10)).provision(REQUEST);

            assertEquals(ProvisioningOutcome.Kind.FAILED, outcome.getKind());
            assertTrue(outcome.getReason().contains("insufficient funds"));
            assertTrue(outcome.getReason().contains("2"));
        }

        @Test
        @DisplayName("Exit 0 with extra stdout lines is ambiguous")
        void provision_ExtraOutput() {
            assertEquals(ProvisioningOutcome.Kind.AMBIGUOUS, provisioner(
                    "echo " + ADDRESS + "; echo", Duration.ofSeconds(10)).provision(REQUEST).getKind());

            ProvisioningOutcome outcome = provisioner(
                    "echo 'tx sent'; echo " + ADDRESS, Duration.ofSeconds(10)).provision(REQUEST);

            assertEquals(ProvisioningOutcome.Kind.AMBIGUOUS, outcome.getKind());
        }

        @Test
        @DisplayName("A timeout is ambiguous, not failed")
        void provision_Timeout() {
            ProvisioningOutcome outcome = provisioner("sleep 5; echo " + ADDRESS, Duration.ofMillis(200))
                    .provision(REQUEST);

            assertEquals(ProvisioningOutcome.Kind.AMBIGUOUS, outcome.getKind());
            assertTrue(outcome.getReason().contains("timed out"));
        }

        @Test
        @DisplayName("A missing executable is a clean failure")
        void provision_CannotStart() {
            ProvisionerProperties properties = new ProvisionerProperties();
            properties.setCommand(List.of("/nonexistent/provisioner-" + UUID.randomUUID()));
            ProcessLedgerProvisioner missing = new ProcessLedgerProvisioner(properties);
            started.add(missing);

            ProvisioningOutcome outcome = missing.provision(REQUEST);

            assertEquals(ProvisioningOutcome.Kind.FAILED, outcome.getKind());
        }
    }
}
