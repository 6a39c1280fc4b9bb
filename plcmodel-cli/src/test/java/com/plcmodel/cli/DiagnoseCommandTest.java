package com.plcmodel.cli;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link DiagnoseCommand}.
 */
class DiagnoseCommandTest extends CommandTestBase {

    @Test
    void diagnose_printsEventsAndStatistics() throws IOException {
        Path export = createFile("plant.xml", PROJECT_EXPORT);

        int exitCode = run("diagnose", export.toString(), "-c", missingConfig());

        assertThat(exitCode).isZero();
        assertThat(stdout())
            .contains("Diagnostics for plant.xml:")
            .contains("STRATEGY_ATTEMPTED application [namespaced-block]")
            .contains("SECTION_LOCATED application [namespaced-block]: 1")
            .contains("RECORD_ACCEPTED Enums [E_Light]")
            .contains("COLLECTION_COUNT POUs: 1")
            .contains("Rejected: 0");
    }

    @Test
    void diagnose_problemsOnly_showsRejections() throws IOException {
        Path export = createFile("plant.xml", PROJECT_EXPORT.replace(
            "<globalVars name=\"GVL\">",
            "<globalVars name=\"GVL\"><variable><type><INT/></type></variable>"));

        int exitCode = run("diagnose", export.toString(), "--problems", "-c", missingConfig());

        assertThat(exitCode).isZero();
        assertThat(stdout())
            .contains("RECORD_REJECTED GlobalVariables")
            .doesNotContain("RECORD_ACCEPTED")
            .contains("Rejected in GlobalVariables: 1");
    }

    @Test
    void diagnose_malformedXml_returnsFailure() throws IOException {
        Path export = createFile("broken.xml", "<project>");

        int exitCode = run("diagnose", export.toString(), "-c", missingConfig());

        assertThat(exitCode).isEqualTo(1);
        assertThat(stderr()).contains("✗ Diagnosis failed:");
    }
}
