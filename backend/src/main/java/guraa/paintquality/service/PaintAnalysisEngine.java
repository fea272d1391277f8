package guraa.paintquality.service;

import guraa.paintquality.analysis.AxisResult;
import guraa.paintquality.analysis.CellBatchRunner;
import guraa.paintquality.analysis.CellBatchRunner.MeasurementJob;
import guraa.paintquality.analysis.ColorAnalyzer;
import guraa.paintquality.analysis.ColorCellMeasurement;
import guraa.paintquality.analysis.CoverageAnalyzer;
import guraa.paintquality.analysis.CoverageCellMeasurement;
import guraa.paintquality.analysis.TextureAnalyzer;
import guraa.paintquality.analysis.TextureCellMeasurement;
import guraa.paintquality.config.AnalysisProperties;
import guraa.paintquality.detection.ProblemDetector;
import guraa.paintquality.exception.AnalysisCancelledException;
import guraa.paintquality.exception.AnalysisException;
import guraa.paintquality.exception.ValidationException;
import guraa.paintquality.grid.Grid;
import guraa.paintquality.grid.GridPartitioner;
import guraa.paintquality.image.ImageInput;
import guraa.paintquality.image.ImageIoDecoder;
import guraa.paintquality.image.ImageNormalizer;
import guraa.paintquality.image.ImagePair;
import guraa.paintquality.model.AnalysisConfig;
import guraa.paintquality.model.AnalysisErrorKind;
import guraa.paintquality.model.AnalysisResult;
import guraa.paintquality.model.AnalysisStatus;
import guraa.paintquality.model.ColorAnalysis;
import guraa.paintquality.model.CoverageAnalysis;
import guraa.paintquality.model.ProblemRegion;
import guraa.paintquality.model.TextureAnalysis;
import guraa.paintquality.scoring.RecommendationContext;
import guraa.paintquality.scoring.RecommendationEngine;
import guraa.paintquality.scoring.ScoreAggregator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs the before/after paint quality pipeline:
 * normalize, partition, measure the three axes, detect regions, score and recommend.
 * <p>
 * The engine holds no per-analysis state, so one instance can serve concurrent callers.
 * Expected failures never escape {@code analyze}; they come back as a FAILED or CANCELLED result.
 */
@Slf4j
@Service
public class PaintAnalysisEngine {

    private final ImageNormalizer normalizer;
    private final GridPartitioner partitioner;
    private final ColorAnalyzer colorAnalyzer;
    private final CoverageAnalyzer coverageAnalyzer;
    private final TextureAnalyzer textureAnalyzer;
    private final ProblemDetector problemDetector;
    private final ScoreAggregator scoreAggregator;
    private final RecommendationEngine recommendationEngine;
    private final CellBatchRunner batchRunner;
    private final AnalysisConfig defaultConfig;

    @Autowired
    public PaintAnalysisEngine(
            @Qualifier("analysisExecutor") ExecutorService executorService,
            ImageNormalizer normalizer,
            GridPartitioner partitioner,
            ColorAnalyzer colorAnalyzer,
            CoverageAnalyzer coverageAnalyzer,
            TextureAnalyzer textureAnalyzer,
            ProblemDetector problemDetector,
            ScoreAggregator scoreAggregator,
            RecommendationEngine recommendationEngine,
            AnalysisProperties analysisProperties) {
        this(executorService, normalizer, partitioner, colorAnalyzer, coverageAnalyzer, textureAnalyzer,
                problemDetector, scoreAggregator, recommendationEngine, analysisProperties.toAnalysisConfig());
    }

    /**
     * Create an engine with the standard components, outside of a Spring context.
     *
     * @param executorService Pool for cell batches, or null to run on the calling thread
     * @param defaultConfig Configuration used when a caller passes none
     */
    public PaintAnalysisEngine(ExecutorService executorService, AnalysisConfig defaultConfig) {
        this(executorService, new ImageNormalizer(new ImageIoDecoder()), new GridPartitioner(),
                new ColorAnalyzer(), new CoverageAnalyzer(), new TextureAnalyzer(), new ProblemDetector(),
                new ScoreAggregator(), new RecommendationEngine(), defaultConfig);
    }

    PaintAnalysisEngine(ExecutorService executorService, ImageNormalizer normalizer, GridPartitioner partitioner,
                        ColorAnalyzer colorAnalyzer, CoverageAnalyzer coverageAnalyzer,
                        TextureAnalyzer textureAnalyzer, ProblemDetector problemDetector,
                        ScoreAggregator scoreAggregator, RecommendationEngine recommendationEngine,
                        AnalysisConfig defaultConfig) {
        this.normalizer = normalizer;
        this.partitioner = partitioner;
        this.colorAnalyzer = colorAnalyzer;
        this.coverageAnalyzer = coverageAnalyzer;
        this.textureAnalyzer = textureAnalyzer;
        this.problemDetector = problemDetector;
        this.scoreAggregator = scoreAggregator;
        this.recommendationEngine = recommendationEngine;
        this.batchRunner = new CellBatchRunner(executorService);
        this.defaultConfig = defaultConfig;
    }

    public AnalysisConfig getDefaultConfig() {
        return defaultConfig;
    }

    /**
     * Analyze a pair with the default configuration.
     */
    public AnalysisResult analyze(ImageInput before, ImageInput after) {
        return analyze(before, after, defaultConfig, new AtomicBoolean(false));
    }

    /**
     * Analyze a pair.
     */
    public AnalysisResult analyze(ImageInput before, ImageInput after, AnalysisConfig config) {
        return analyze(before, after, config, new AtomicBoolean(false));
    }

    /**
     * Analyze a pair with cooperative cancellation.
     *
     * @param before The before image
     * @param after The after image
     * @param config The analysis configuration, or null for the default
     * @param cancellationToken Set by the caller to stop the analysis; may be null
     * @return A COMPLETED result, or a FAILED/CANCELLED result carrying the error kind and message
     */
    public AnalysisResult analyze(ImageInput before, ImageInput after, AnalysisConfig config,
                                  AtomicBoolean cancellationToken) {
        long startTime = System.nanoTime();
        AnalysisConfig effectiveConfig = config != null ? config : defaultConfig;
        AtomicBoolean token = cancellationToken != null ? cancellationToken : new AtomicBoolean(false);

        log.info("Starting paint quality analysis ({} and {} bytes)", sizeOf(before), sizeOf(after));
        try {
            AnalysisResult result = runPipeline(before, after, effectiveConfig, token, startTime);
            log.info("Analysis completed in {}s: score {}, {} issue(s)",
                    String.format("%.3f", result.getProcessingDuration()),
                    String.format("%.1f", result.getOverallScore()), result.getIssuesDetected());
            return result;
        } catch (AnalysisCancelledException e) {
            log.warn("Analysis cancelled: {}", e.getMessage());
            return AnalysisResult.failure(AnalysisErrorKind.CANCELLED, e.getMessage(), elapsedSeconds(startTime));
        } catch (AnalysisException e) {
            log.warn("Analysis failed with {}: {}", e.getKind(), e.getMessage());
            return AnalysisResult.failure(e.getKind(), e.getMessage(), elapsedSeconds(startTime));
        } catch (RuntimeException e) {
            log.error("Unexpected error during analysis: {}", e.getMessage(), e);
            return AnalysisResult.failure(AnalysisErrorKind.INTERNAL_COMPUTATION_ERROR,
                    "Internal error during analysis: " + e, elapsedSeconds(startTime));
        }
    }

    /**
     * Validate, decode and reconcile a pair without analyzing it, e.g. to render an overlay.
     *
     * @param before The before image
     * @param after The after image
     * @param config The analysis configuration, or null for the default
     * @return The normalized pair the analysis coordinates refer to
     * @throws AnalysisException If the inputs cannot be normalized
     */
    public ImagePair normalize(ImageInput before, ImageInput after, AnalysisConfig config) throws AnalysisException {
        return normalizer.normalize(before, after, config != null ? config : defaultConfig);
    }

    private AnalysisResult runPipeline(ImageInput before, ImageInput after, AnalysisConfig config,
                                       AtomicBoolean token, long startTime) throws AnalysisException {
        List<String> problems = config.problems();
        if (!problems.isEmpty()) {
            throw new ValidationException("Invalid analysis configuration: " + String.join("; ", problems));
        }
        checkCancelled(token, "before decoding");

        ImagePair pair = normalizer.normalize(before, after, config);
        checkCancelled(token, "after normalization");

        Grid grid = partitioner.partition(pair.getWidth(), pair.getHeight(), config);
        log.debug("Analyzing {}x{} image on {}", pair.getWidth(), pair.getHeight(), grid);

        // All batches of all axes are queued before anything is awaited
        MeasurementJob<ColorCellMeasurement> colorJob = batchRunner.submit(colorAnalyzer, grid, pair, config, token);
        MeasurementJob<CoverageCellMeasurement> coverageJob = batchRunner.submit(coverageAnalyzer, grid, pair, config, token);
        MeasurementJob<TextureCellMeasurement> textureJob = batchRunner.submit(textureAnalyzer, grid, pair, config, token);

        AxisResult<ColorAnalysis> color;
        AxisResult<CoverageAnalysis> coverage;
        AxisResult<TextureAnalysis> texture;
        try {
            color = colorAnalyzer.summarize(grid, colorJob.await(), config);
            coverage = coverageAnalyzer.summarize(grid, coverageJob.await(), config);
            texture = textureAnalyzer.summarize(grid, textureJob.await(), config);
        } catch (AnalysisException | RuntimeException e) {
            // Nothing will read the other axes any more
            colorJob.abort();
            coverageJob.abort();
            textureJob.abort();
            throw e;
        }
        log.debug("Axis summaries: {} / {} / {}", color.getSummary(), coverage.getSummary(), texture.getSummary());
        checkCancelled(token, "after measurement");

        List<ProblemRegion> regions = problemDetector.detect(grid,
                color.getMetrics(), coverage.getMetrics(), texture.getMetrics(), config);
        checkCancelled(token, "after detection");

        double score = scoreAggregator.score(color.getSummary(), coverage.getSummary(), texture.getSummary(),
                regions, config);
        List<String> recommendations = recommendationEngine.recommend(new RecommendationContext(
                color.getSummary(), coverage.getSummary(), texture.getSummary(), regions, config));

        return AnalysisResult.builder()
                .status(AnalysisStatus.COMPLETED)
                .overallScore(score)
                .issuesDetected(regions.size())
                .imageWidth(pair.getWidth())
                .imageHeight(pair.getHeight())
                .colorAnalysis(color.getSummary())
                .coverageAnalysis(coverage.getSummary())
                .textureAnalysis(texture.getSummary())
                .problemRegions(regions)
                .recommendations(recommendations)
                .processingDuration(elapsedSeconds(startTime))
                .build();
    }

    private static void checkCancelled(AtomicBoolean token, String stage) throws AnalysisCancelledException {
        if (token.get()) {
            throw new AnalysisCancelledException("Analysis cancelled " + stage);
        }
    }

    private static int sizeOf(ImageInput input) {
        return input == null ? 0 : input.size();
    }

    private static double elapsedSeconds(long startTime) {
        return (System.nanoTime() - startTime) / 1_000_000_000.0;
    }
}
