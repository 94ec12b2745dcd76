package com.termdag;

import com.termdag.api.CycleFoundException;
import com.termdag.io.GraphDefinitionLoader;
import com.termdag.util.PhaseTimingListener;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import lombok.extern.log4j.Log4j2;

/**
 * Renders a sample graph, or each file named on the command line ({@code .json}
 * definitions or arrow text), and logs the diagram with per-phase timings.
 */
@Log4j2
public class DagTextDemo {

    static final String SAMPLE = "A -> B -> C\nA -> D -> C\nB -> D\nE -> C\nE -> F";

    public static void main(String[] args) throws IOException {
        var timing = new PhaseTimingListener();
        var renderer = DagText.create().withListener(timing);

        if (args.length == 0) {
            log.info("Rendering sample graph:\n{}", renderer.renderText(SAMPLE));
        }
        for (String arg : args) {
            Path path = Path.of(arg);
            try {
                String diagram = path.toString().endsWith(".json")
                        ? renderer.renderDefinition(GraphDefinitionLoader.parseFile(path))
                        : renderer.renderText(Files.readString(path));
                log.info("{}:\n{}", path, diagram);
            } catch (CycleFoundException e) {
                log.error("{}: {}", path, e.getMessage());
            }
        }
        log.info("Phase timings:\n{}", timing.dump());
    }
}
