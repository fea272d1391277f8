package guraa.paintquality.analysis;

import guraa.paintquality.exception.AnalysisException;
import guraa.paintquality.grid.Grid;
import guraa.paintquality.grid.GridPartitioner;
import guraa.paintquality.image.ImagePair;
import guraa.paintquality.image.RasterImage;
import guraa.paintquality.model.AnalysisConfig;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs one analyzer over a whole pair on the calling thread.
 */
final class AnalyzerFixtures {

    private AnalyzerFixtures() {
    }

    static Grid grid(RasterImage image, AnalysisConfig config) {
        return new GridPartitioner().partition(image.getWidth(), image.getHeight(), config);
    }

    static <M, S> AxisResult<S> run(CellAnalyzer<M, S> analyzer, RasterImage before, RasterImage after,
                                    AnalysisConfig config) throws AnalysisException {
        ImagePair pair = new ImagePair(before, after);
        Grid grid = grid(before, config);
        CellBatchRunner runner = new CellBatchRunner(null);
        return analyzer.summarize(grid, runner.submit(analyzer, grid, pair, config, new AtomicBoolean()).await(), config);
    }
}
