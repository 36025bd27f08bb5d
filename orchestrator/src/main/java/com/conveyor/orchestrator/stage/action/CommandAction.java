package com.conveyor.orchestrator.stage.action;

import com.conveyor.orchestrator.model.ArtifactReference;
import com.conveyor.orchestrator.model.PipelineDefinition;
import com.conveyor.orchestrator.model.StageSpec;
import com.conveyor.orchestrator.stage.ActionOutcome;
import com.conveyor.orchestrator.stage.StageAction;
import com.conveyor.orchestrator.stage.StageContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Runs the stage's argument list as an OS process. Exit code 0 is success.
 *
 * Parameters:
 *   workdir   working directory (defaults to the service's)
 *   env.NAME  extra environment variable NAME
 *
 * The process also sees CONVEYOR_RUN_ID, CONVEYOR_PIPELINE, CONVEYOR_STAGE,
 * CONVEYOR_SOURCE_VERSION and, when the run carries one, CONVEYOR_ARTIFACT_ID /
 * CONVEYOR_ARTIFACT_VERSION. Run parameters are exported as CONVEYOR_PARAM_NAME.
 *
 * stdout and stderr go to one temp file; the last 8 KiB become the stage's
 * diagnostic output. An interrupt destroys the whole process tree.
 */
@Component
public class CommandAction implements StageAction {

    private static final Logger log = LoggerFactory.getLogger(CommandAction.class);

    static final int OUTPUT_TAIL_BYTES = 8 * 1024;

    @Override
    public String type() {
        return "command";
    }

    @Override
    public List<String> problems(StageSpec spec, PipelineDefinition pipeline) {
        if (spec.action().args().isEmpty()) {
            return List.of("stage '" + spec.name() + "' has an empty command line");
        }
        return List.of();
    }

    @Override
    public ActionOutcome perform(StageSpec spec, StageContext ctx) throws IOException, InterruptedException {
        ProcessBuilder pb = new ProcessBuilder(spec.action().args());
        String workdir = spec.action().param("workdir");
        if (workdir != null) {
            pb.directory(new File(workdir));
        }
        exportEnvironment(pb.environment(), spec, ctx);

        Path outputFile = Files.createTempFile("conveyor-" + spec.name() + "-", ".log");
        pb.redirectErrorStream(true);
        pb.redirectOutput(outputFile.toFile());

        Process process = null;
        try {
            log.info("Running {}", spec.action().args());
            process = pb.start();
            int exitCode = process.waitFor();
            String output = tail(outputFile);
            log.info("Command exited with {}", exitCode);
            return ActionOutcome.exited(exitCode, output);
        } catch (InterruptedException e) {
            destroyTree(process);
            throw e;
        } finally {
            Files.deleteIfExists(outputFile);
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static void exportEnvironment(Map<String, String> env, StageSpec spec, StageContext ctx) {
        env.put("CONVEYOR_RUN_ID",         ctx.runId().toString());
        env.put("CONVEYOR_PIPELINE",       ctx.pipeline());
        env.put("CONVEYOR_STAGE",          spec.name());
        env.put("CONVEYOR_SOURCE_VERSION", String.valueOf(ctx.run().sourceVersion()));

        ArtifactReference artifact = ctx.artifact();
        if (artifact != null) {
            env.put("CONVEYOR_ARTIFACT_ID",      artifact.id());
            env.put("CONVEYOR_ARTIFACT_VERSION", artifact.version());
        }
        ctx.run().parameters().forEach((k, v) ->
                env.put("CONVEYOR_PARAM_" + k.toUpperCase().replace('-', '_').replace('.', '_'), v));
        spec.action().params().forEach((k, v) -> {
            if (k.startsWith("env.")) {
                env.put(k.substring("env.".length()), v);
            }
        });
    }

    private static void destroyTree(Process process) {
        if (process == null) return;
        log.info("Destroying process {} and its descendants", process.pid());
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    static String tail(Path file) throws IOException {
        try (RandomAccessFile raf = new RandomAccessFile(file.toFile(), "r")) {
            long length = raf.length();
            long start  = Math.max(0, length - OUTPUT_TAIL_BYTES);
            byte[] buf  = new byte[(int) (length - start)];
            raf.seek(start);
            raf.readFully(buf);
            String text = new String(buf, StandardCharsets.UTF_8);
            return start > 0 ? "...(truncated)\n" + text : text;
        }
    }
}
