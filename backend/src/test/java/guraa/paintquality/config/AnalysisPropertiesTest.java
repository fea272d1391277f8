package guraa.paintquality.config;

import guraa.paintquality.model.AnalysisConfig;
import guraa.paintquality.model.SeverityAggregation;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AnalysisPropertiesTest {

    @Test
    void unboundPropertiesMatchConfigDefaults() {
        assertEquals(AnalysisConfig.defaults(), new AnalysisProperties().toAnalysisConfig());
    }

    @Test
    void groupsMapOntoConfig() {
        AnalysisProperties properties = new AnalysisProperties();
        properties.getGrid().setCellSize(32);
        properties.getDetection().setThreshold(0.5);
        properties.getDetection().setSeverityAggregation(SeverityAggregation.MEAN);
        properties.getRecommendations().setMaxRegions(9);

        AnalysisConfig config = properties.toAnalysisConfig();

        assertEquals(32, config.getCellSize());
        assertEquals(0.5, config.getDetectionThreshold());
        assertEquals(SeverityAggregation.MEAN, config.getSeverityAggregation());
        assertEquals(9, config.getMaxRegions());
        assertTrue(config.problems().isEmpty());
    }
}
