package guraa.paintquality;

import guraa.paintquality.model.AnalysisConfig;
import guraa.paintquality.service.PaintAnalysisEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

/**
 * Main application class for the paint quality analysis engine.
 * Runs without a web server; the engine is exposed as a bean for the layers that embed it.
 */
@Slf4j
@SpringBootApplication
public class PaintQualityApplication {

    public static void main(String[] args) {
        Instant startTime = Instant.now();

        // Image decoding and overlay rendering never need a display
        System.getProperties().putIfAbsent("java.awt.headless", "true");

        ConfigurableApplicationContext context = SpringApplication.run(PaintQualityApplication.class, args);

        AnalysisConfig defaults = context.getBean(PaintAnalysisEngine.class).getDefaultConfig();
        log.info(readySummary(Duration.between(startTime, Instant.now()), defaults));
    }

    /**
     * One-line summary of the defaults the engine will apply when a caller passes no config.
     */
    static String readySummary(Duration startupTime, AnalysisConfig defaults) {
        String grid = defaults.getTargetCellCount() > 0
                ? "~" + defaults.getTargetCellCount() + " cells"
                : defaults.getCellSize() + "px cells";
        return String.format(Locale.ROOT, "Paint quality engine ready in %s (grid %s, color metric %s, weights %.2f/%.2f/%.2f)",
                formatDuration(startupTime), grid, defaults.getColorMetric(),
                defaults.getColorWeight(), defaults.getCoverageWeight(), defaults.getTextureWeight());
    }

    /**
     * Format a duration to a readable string.
     *
     * @param duration The duration
     * @return A formatted string (e.g., "1m 2.345s")
     */
    static String formatDuration(Duration duration) {
        long minutes = duration.toMinutes();
        long seconds = duration.toSecondsPart();
        long millis = duration.toMillisPart();

        if (minutes > 0) {
            return String.format("%dm %d.%03ds", minutes, seconds, millis);
        }
        return String.format("%d.%03ds", seconds, millis);
    }

    @EventListener
    public void onApplicationEvent(ContextClosedEvent event) {
        log.info("Paint quality engine is shutting down");
    }
}
