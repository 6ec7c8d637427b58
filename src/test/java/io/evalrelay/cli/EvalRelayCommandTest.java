package io.evalrelay.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.evalrelay.solver.ConstantSolver;
import io.evalrelay.solver.InferenceServer;
import io.evalrelay.support.RunningResponder;
import io.evalrelay.support.TempDirs;
import io.evalrelay.util.Jsons;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

final class EvalRelayCommandTest {
    private Path root;
    private PrintStream originalOut;
    private ByteArrayOutputStream captured;

    @BeforeEach
    void setUp() throws Exception {
        root = Files.createTempDirectory("evalrelay-cli-");
        originalOut = System.out;
        captured = new ByteArrayOutputStream();
        System.setOut(new PrintStream(captured, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void tearDown() throws Exception {
        System.setOut(originalOut);
        TempDirs.deleteRecursively(root);
    }

    @Test
    void gatewayFeedsTheResponderAndRecordsTheRun() throws Exception {
        Path problems = root.resolve("test.csv");
        Files.writeString(problems, "id,problem\np1,2+2\np2,3+3\n");
        Path out = root.resolve("submission.csv");
        try (InferenceServer<Long> server = InferenceServer.start(new ConstantSolver(7L));
             RunningResponder responder = RunningResponder.start(server.responder())) {
            int exit = execute(
                    "--root", root.resolve("data").toString(),
                    "--address", responder.address().toString(),
                    "gateway",
                    "--problems", problems.toString(),
                    "--out", out.toString(),
                    "--ordering", "fixed",
                    "--seed", "5",
                    "--run-id", "cli-run"
            );

            Assertions.assertEquals(0, exit);
            Assertions.assertEquals(List.of("id,answer", "p1,7", "p2,7"), Files.readAllLines(out));
            JsonNode summary = Jsons.mapper().readTree(lastJson());
            Assertions.assertEquals("DONE", summary.get("state").asText());
            Assertions.assertEquals("fixed", summary.get("ordering").asText());
            Assertions.assertEquals(2, summary.get("statusCounts").get("OK").asInt());
        }

        Assertions.assertEquals(0, execute("--root", root.resolve("data").toString(), "records", "cli-run"));
        Assertions.assertEquals(0, execute("validate", "--problems", problems.toString(), "--submission", out.toString()));
        Assertions.assertEquals(1, execute("--root", root.resolve("data").toString(), "records", "no-such-run"));
    }

    @Test
    void gatewayExitsNonZeroWhenTheResponderNeverAppears() throws Exception {
        Path problems = root.resolve("test.csv");
        Files.writeString(problems, "id,problem\np1,2+2\n");
        Path out = root.resolve("submission.csv");
        int port;
        try (ServerSocket spare = new ServerSocket(0)) {
            port = spare.getLocalPort();
        }

        int exit = execute(
                "--root", root.resolve("data").toString(),
                "--address", "127.0.0.1:" + port,
                "gateway",
                "--problems", problems.toString(),
                "--out", out.toString(),
                "--grace-ms", "0"
        );

        Assertions.assertEquals(1, exit);
        Assertions.assertFalse(Files.exists(out));
        Assertions.assertEquals("FAILED", Jsons.mapper().readTree(lastJson()).get("state").asText());
    }

    @Test
    void localEvalScoresAReferenceSet() throws Exception {
        Path reference = root.resolve("reference.csv");
        Files.writeString(reference, "id,problem,answer\nr1,a,0\nr2,b,3\n");

        int exit = execute("local-eval", "--reference", reference.toString(), "--solver", "constant");

        Assertions.assertEquals(0, exit);
        JsonNode report = Jsons.mapper().readTree(lastJson());
        Assertions.assertEquals(1, report.get("correct").asInt());
        Assertions.assertEquals(2, report.get("total").asInt());
    }

    @Test
    void serveOutsideAScoredRunNeedsAReferenceOrForce() throws Exception {
        Path reference = root.resolve("reference.csv");
        Files.writeString(reference, "id,problem,answer\nr1,a,4\n");

        Assertions.assertEquals(2, execute("--root", root.toString(), "serve"));
        Assertions.assertEquals(0, execute("--root", root.toString(), "serve",
                "--reference", reference.toString(), "--solver", "constant", "--constant-answer", "4"));
        Assertions.assertEquals(1, Jsons.mapper().readTree(lastJson()).get("correct").asInt());
    }

    private static int execute(String... args) {
        return new CommandLine(new EvalRelayCommand()).execute(args);
    }

    private String lastJson() {
        String all = captured.toString(StandardCharsets.UTF_8);
        int start = all.lastIndexOf("\n{");
        return start < 0 ? all : all.substring(start + 1);
    }
}
