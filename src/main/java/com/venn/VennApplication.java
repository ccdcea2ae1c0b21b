package com.venn;

import com.venn.geometry.CircleRegion;
import com.venn.geometry.Point;
import com.venn.spring.EnableVenn;
import com.venn.view.AsciiRasterRenderer;
import com.venn.view.Rendering;
import com.venn.view.RenderingJsonWriter;
import com.venn.view.SetVisualizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.util.ArrayList;
import java.util.List;

/**
 * Command-line demo: renders each formula given as an argument,
 * or the default formula when there are none.
 */
@SpringBootApplication
@EnableVenn
public class VennApplication {

    private static final Logger log = LoggerFactory.getLogger(VennApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(VennApplication.class, args);
    }

    @Bean
    public CommandLineRunner demo(SetVisualizer visualizer, RenderingJsonWriter jsonWriter) {
        return args -> {
            log.info("=== Venn Demo Started ===");

            List<String> formulas = new ArrayList<>();
            for (String arg : args) {
                // Spring options are not formulas
                if (!arg.startsWith("--")) {
                    formulas.add(arg);
                }
            }
            if (formulas.isEmpty()) {
                formulas.add(visualizer.getDefaultExpression());
            }

            for (String formula : formulas) {
                show(visualizer, visualizer.update(formula), jsonWriter);
            }

            // Drag A two units to the right and show the current formula again
            Point from = visualizer.getLayout().region("A").map(CircleRegion::center).orElse(null);
            if (from != null) {
                Point to = from.translate(2, 0);
                visualizer.drag(from, to).ifPresent(rendering -> {
                    log.info("After dragging A by (2, 0):");
                    show(visualizer, rendering, jsonWriter);
                });
            }

            log.info("=== Venn Demo Finished ===");
        };
    }

    private static void show(SetVisualizer visualizer, Rendering rendering, RenderingJsonWriter jsonWriter) {
        log.info(SetVisualizer.title(rendering));
        rendering.errorMessage().ifPresent(error -> log.info("Error: {}", error));
        log.info("\n{}", AsciiRasterRenderer.render(visualizer.getLayout().grid(), rendering.result()));
        log.debug("JSON: {}", jsonWriter.write(rendering));
    }
}
