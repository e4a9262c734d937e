package com.project.image.analysis.service;

import com.project.image.analysis.DTOs.AnalysisError;
import com.project.image.analysis.DTOs.AnalysisOutcome;
import com.project.image.analysis.DTOs.LineOrientation;
import com.project.image.analysis.DTOs.ShapeComplexity;
import com.project.image.analysis.DTOs.ShapeDistribution;
import com.project.image.analysis.DTOs.ShapeProfile;
import com.project.image.analysis.DTOs.ShapeRecord;
import com.project.image.analysis.DTOs.ShapeType;
import com.project.image.analysis.exceptions.ImageAnalysisException;
import com.project.image.analysis.service.classification.PolygonMetrics;
import com.project.image.analysis.service.classification.ShapeRules;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.MatOfPoint;
import org.opencv.core.MatOfPoint2f;
import org.opencv.core.Point;
import org.opencv.core.Rect;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.opencv.imgproc.Moments;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Finds closed regions, straight lines and circles on a fixed 512x512 working
 * canvas and summarizes them as a {@link ShapeProfile}.
 */
@Service
public class ShapeDetector {
    private static final Logger log = LoggerFactory.getLogger(ShapeDetector.class);

    static final String STAGE = "shape";
    static final int WORK_SIZE = 512;
    static final double CANNY_LOW = 25;
    static final double CANNY_HIGH = 50;
    static final double MIN_AREA = 100;
    static final double APPROX_TOLERANCE = 0.02;
    private static final int MIN_CONTOUR_POINTS = 5;
    private static final int BACKGROUND_MARGIN = 4;

    /** Parameters of the OpenCV gradient Hough circle search. */
    public record CircleSettings(double minDistance, double cannyThreshold, double accumulatorThreshold,
                                 int minRadius, int maxRadius) {
        public static final CircleSettings DEFAULTS = new CircleSettings(20, 50, 30, 10, 100);

        public CircleSettings {
            if (minRadius < 0 || maxRadius < minRadius) {
                throw new IllegalArgumentException("Invalid circle radius range " + minRadius + ".." + maxRadius);
            }
        }
    }

    private final CircleSettings circleSettings;
    private final HoughLineTransform lineTransform = new HoughLineTransform(180, 10, 0.5, 9, 10);

    @Autowired
    public ShapeDetector(@Value("${app.analysis.hough.circle-min-distance:20}") double minDistance,
                         @Value("${app.analysis.hough.circle-canny-threshold:50}") double cannyThreshold,
                         @Value("${app.analysis.hough.circle-accumulator-threshold:30}") double accumulatorThreshold,
                         @Value("${app.analysis.hough.circle-min-radius:10}") int minRadius,
                         @Value("${app.analysis.hough.circle-max-radius:100}") int maxRadius) {
        this(new CircleSettings(minDistance, cannyThreshold, accumulatorThreshold, minRadius, maxRadius));
    }

    public ShapeDetector(CircleSettings circleSettings) {
        this.circleSettings = circleSettings;
    }

    public AnalysisOutcome<ShapeProfile> detectShapes(BufferedImage image) {
        try {
            return AnalysisOutcome.success(profile(image));
        } catch (RuntimeException e) {
            log.warn("Shape detection failed: {}", e.getMessage());
            return AnalysisOutcome.failure(AnalysisError.of(STAGE, e), ShapeProfile.unknown());
        }
    }

    private ShapeProfile profile(BufferedImage image) {
        try (EdgeTrace trace = EdgeTrace.of(image)) {
            List<ShapeRecord> records = new ArrayList<>();
            for (Region region : trace.regions()) {
                records.add(region.record());
            }
            records.sort(Comparator.comparingDouble(ShapeRecord::area).reversed());

            List<HoughLineTransform.Line> lines = lineTransform.detect(edgeMask(trace.edges()), WORK_SIZE, WORK_SIZE);
            int circleCount = countCircles(trace.blurred());
            log.debug("Traced {} regions, {} lines, {} circles", records.size(), lines.size(), circleCount);
            return aggregate(records, lines, circleCount);
        }
    }

    private ShapeProfile aggregate(List<ShapeRecord> records, List<HoughLineTransform.Line> lines, int circleCount) {
        int count = records.size();
        ShapeComplexity complexity = ShapeRules.COMPLEXITY.classify(count);

        double covered = 0;
        for (ShapeRecord r : records) covered += r.area();
        ShapeDistribution distribution = ShapeRules.DISTRIBUTION.classify(covered / (WORK_SIZE * WORK_SIZE));

        List<String> dominant = dominantShapes(records, !lines.isEmpty(), circleCount, complexity);
        List<ShapeRecord> details = records.subList(0, Math.min(ShapeProfile.MAX_DETAILS, count));

        return new ShapeProfile(dominant, count, !lines.isEmpty(), circleCount > 0, complexity, distribution,
                details, lines.size(), dominantOrientation(lines), circleCount);
    }

    static List<String> dominantShapes(List<ShapeRecord> records, boolean hasLines, int circleCount,
                                       ShapeComplexity complexity) {
        Map<ShapeType, Integer> counts = new LinkedHashMap<>();
        for (ShapeRecord r : records) {
            counts.merge(r.type(), 1, Integer::sum);
        }
        List<String> dominant = new ArrayList<>();
        counts.entrySet().stream()
                .filter(e -> e.getValue() > 1)
                .sorted(Map.Entry.<ShapeType, Integer>comparingByValue().reversed())
                .limit(3)
                .forEach(e -> dominant.add(e.getKey().label()));

        if (hasLines && dominant.isEmpty()) {
            dominant.add("Geometric");
        }
        if (circleCount > 0 && !dominant.contains(ShapeType.CIRCLE.label())) {
            dominant.add("Circular");
        }
        if (dominant.isEmpty()) {
            dominant.add(complexity == ShapeComplexity.HIGH ? "Complex" : "Organic");
        }
        return dominant;
    }

    static LineOrientation dominantOrientation(List<HoughLineTransform.Line> lines) {
        if (lines.isEmpty()) {
            return LineOrientation.NONE;
        }
        Map<LineOrientation, Integer> counts = new EnumMap<>(LineOrientation.class);
        for (HoughLineTransform.Line line : lines) {
            counts.merge(ShapeRules.LINE_ORIENTATION.classify(line.angle()), 1, Integer::sum);
        }
        LineOrientation best = LineOrientation.HORIZONTAL;
        // enum order breaks ties: Horizontal, Vertical, Diagonal
        for (LineOrientation o : List.of(LineOrientation.VERTICAL, LineOrientation.DIAGONAL)) {
            if (counts.getOrDefault(o, 0) > counts.getOrDefault(best, 0)) {
                best = o;
            }
        }
        return best;
    }

    private int countCircles(Mat blurred) {
        Mat circles = new Mat();
        try {
            Imgproc.HoughCircles(blurred, circles, Imgproc.HOUGH_GRADIENT, 1,
                    circleSettings.minDistance(), circleSettings.cannyThreshold(),
                    circleSettings.accumulatorThreshold(), circleSettings.minRadius(), circleSettings.maxRadius());
            return circles.empty() ? 0 : circles.cols();
        } finally {
            circles.release();
        }
    }

    private static boolean[] edgeMask(Mat edges) {
        byte[] data = new byte[WORK_SIZE * WORK_SIZE];
        edges.get(0, 0, data);
        boolean[] mask = new boolean[data.length];
        for (int i = 0; i < data.length; i++) {
            mask[i] = data[i] != 0;
        }
        return mask;
    }

    /**
     * 2x2 panel: working image, edge map, traced region boundaries and the
     * simplified polygons labelled with their shape type.
     */
    public BufferedImage renderShapePanel(BufferedImage image) {
        try (EdgeTrace trace = EdgeTrace.of(image)) {
            Mat panel = new Mat(WORK_SIZE * 2, WORK_SIZE * 2, CvType.CV_8UC3, new Scalar(0, 0, 0));
            Mat original = new Mat();
            Mat edges = new Mat();
            Mat contours = Mat.zeros(WORK_SIZE, WORK_SIZE, CvType.CV_8UC3);
            Mat polygons = new Mat();
            Mat color = OpenCvSupport.bufferedImageToMat(image);
            try {
                Imgproc.resize(color, original, new Size(WORK_SIZE, WORK_SIZE), 0, 0, Imgproc.INTER_LINEAR);
                Imgproc.cvtColor(trace.edges(), edges, Imgproc.COLOR_GRAY2BGR);
                original.copyTo(polygons);

                List<MatOfPoint> traced = new ArrayList<>();
                List<MatOfPoint> simplified = new ArrayList<>();
                for (Region region : trace.regions()) {
                    traced.add(region.contour());
                    simplified.add(new MatOfPoint(region.approx().toArray()));
                }
                Imgproc.drawContours(contours, traced, -1, new Scalar(0, 255, 0), 2);
                Imgproc.polylines(polygons, simplified, true, new Scalar(0, 0, 255), 2);
                for (Region region : trace.regions()) {
                    ShapeRecord.Centroid c = region.record().centroid();
                    Imgproc.putText(polygons, region.record().type().label(), new Point(c.x() - 30, c.y()),
                            Imgproc.FONT_HERSHEY_SIMPLEX, 0.6, new Scalar(255, 0, 0), 2);
                }

                original.copyTo(panel.submat(0, WORK_SIZE, 0, WORK_SIZE));
                edges.copyTo(panel.submat(0, WORK_SIZE, WORK_SIZE, WORK_SIZE * 2));
                contours.copyTo(panel.submat(WORK_SIZE, WORK_SIZE * 2, 0, WORK_SIZE));
                polygons.copyTo(panel.submat(WORK_SIZE, WORK_SIZE * 2, WORK_SIZE, WORK_SIZE * 2));
                simplified.forEach(Mat::release);
                return OpenCvSupport.matToBufferedImage(panel);
            } finally {
                panel.release();
                original.release();
                edges.release();
                contours.release();
                polygons.release();
                color.release();
            }
        }
    }

    /** One retained region: its traced boundary, simplified polygon and measurements. */
    record Region(MatOfPoint contour, MatOfPoint2f approx, ShapeRecord record) {}

    /**
     * Grayscale, blurred and edge matrices of one image together with the
     * regions traced from them. Closing releases every native buffer.
     */
    static final class EdgeTrace implements AutoCloseable {
        private final Mat gray;
        private final Mat blurred;
        private final Mat edges;
        private final List<Region> regions;

        private EdgeTrace(Mat gray, Mat blurred, Mat edges, List<Region> regions) {
            this.gray = gray;
            this.blurred = blurred;
            this.edges = edges;
            this.regions = regions;
        }

        static EdgeTrace of(BufferedImage image) {
            if (image == null) {
                throw new ImageAnalysisException("No image to detect shapes in");
            }
            OpenCvSupport.ensureLoaded();
            Mat gray = OpenCvSupport.grayscale(image, WORK_SIZE, WORK_SIZE);
            Mat blurred = new Mat();
            Mat edges = new Mat();
            Imgproc.GaussianBlur(gray, blurred, new Size(5, 5), 0);
            Imgproc.Canny(blurred, edges, CANNY_LOW, CANNY_HIGH);
            return new EdgeTrace(gray, blurred, edges, traceRegions(edges));
        }

        Mat blurred() {
            return blurred;
        }

        Mat edges() {
            return edges;
        }

        List<Region> regions() {
            return regions;
        }

        @Override
        public void close() {
            gray.release();
            blurred.release();
            edges.release();
            for (Region region : regions) {
                region.contour().release();
                region.approx().release();
            }
        }
    }

    /**
     * Regions are the holes of the dilated edge network. A one pixel frame
     * closes regions that run off the canvas; the frame's own interior is
     * background and skipped.
     */
    private static List<Region> traceRegions(Mat edges) {
        Mat closed = new Mat();
        Mat hierarchy = new Mat();
        Mat kernel = Imgproc.getStructuringElement(Imgproc.MORPH_RECT, new Size(3, 3));
        List<MatOfPoint> contours = new ArrayList<>();
        List<Region> regions = new ArrayList<>();
        try {
            Imgproc.dilate(edges, closed, kernel);
            Imgproc.rectangle(closed, new Point(0, 0), new Point(WORK_SIZE - 1, WORK_SIZE - 1), new Scalar(255), 1);
            Imgproc.findContours(closed, contours, hierarchy, Imgproc.RETR_CCOMP, Imgproc.CHAIN_APPROX_NONE);

            for (int i = 0; i < contours.size(); i++) {
                MatOfPoint contour = contours.get(i);
                double[] links = hierarchy.get(0, i);
                Rect box = Imgproc.boundingRect(contour);
                boolean hole = links != null && links[3] >= 0;
                boolean background = box.width >= WORK_SIZE - BACKGROUND_MARGIN
                        && box.height >= WORK_SIZE - BACKGROUND_MARGIN;
                Region region = hole && !background && contour.total() >= MIN_CONTOUR_POINTS
                        ? measure(contour) : null;
                if (region != null) {
                    regions.add(region);
                } else {
                    contour.release();
                }
            }
            return regions;
        } finally {
            closed.release();
            hierarchy.release();
            kernel.release();
        }
    }

    private static Region measure(MatOfPoint contour) {
        MatOfPoint2f curve = new MatOfPoint2f(contour.toArray());
        MatOfPoint2f approx = new MatOfPoint2f();
        try {
            double arc = Imgproc.arcLength(curve, true);
            Imgproc.approxPolyDP(curve, approx, APPROX_TOLERANCE * arc, true);
        } finally {
            curve.release();
        }

        double area = Imgproc.contourArea(approx);
        if (area < MIN_AREA) {
            approx.release();
            return null;
        }
        Point[] vertices = approx.toArray();
        double perimeter = Imgproc.arcLength(approx, true);
        double compactness = perimeter > 0 ? Math.min(1.0, 4 * Math.PI * area / (perimeter * perimeter)) : 0.0;

        double minX = Double.MAX_VALUE, maxX = -Double.MAX_VALUE, minY = Double.MAX_VALUE, maxY = -Double.MAX_VALUE;
        double sumX = 0, sumY = 0;
        for (Point p : vertices) {
            minX = Math.min(minX, p.x);
            maxX = Math.max(maxX, p.x);
            minY = Math.min(minY, p.y);
            maxY = Math.max(maxY, p.y);
            sumX += p.x;
            sumY += p.y;
        }
        double height = maxY - minY;
        double aspect = height == 0 ? 1.0 : (maxX - minX) / height;

        Moments m = Imgproc.moments(approx);
        ShapeRecord.Centroid centroid = m.m00 != 0
                ? new ShapeRecord.Centroid(m.m10 / m.m00, m.m01 / m.m00)
                : new ShapeRecord.Centroid(sumX / vertices.length, sumY / vertices.length);

        ShapeType type = ShapeRules.SHAPE_TYPE.classify(new PolygonMetrics(vertices.length, compactness, aspect));
        return new Region(contour, approx,
                new ShapeRecord(type, vertices.length, area, perimeter, compactness, aspect, centroid));
    }
}
