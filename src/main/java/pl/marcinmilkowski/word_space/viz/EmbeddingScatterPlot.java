package pl.marcinmilkowski.word_space.viz;

import pl.marcinmilkowski.word_space.embedding.EmbeddingMatrix;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Scatter plot of two-dimensional word embeddings as SVG.
 * Each word is a dot at (dim 0, dim 1) with its label next to it.
 */
public class EmbeddingScatterPlot {

    private static final double MARGIN = 60;

    private static class Point {
        final String word;
        final double x;
        final double y;

        Point(String word, double x, double y) {
            this.word = word;
            this.x = x;
            this.y = y;
        }
    }

    private final List<Point> points;
    private final int width;
    private final int height;

    /**
     * Plot every word of the embedding.
     */
    public EmbeddingScatterPlot(EmbeddingMatrix embedding, int width, int height) {
        this(embedding, embedding.vocabulary().tokens(), width, height);
    }

    /**
     * Plot only the given words.
     *
     * @throws IllegalArgumentException if the embedding has fewer than two dimensions
     * @throws pl.marcinmilkowski.word_space.vocab.UnknownTokenException if a word is unknown
     */
    public EmbeddingScatterPlot(EmbeddingMatrix embedding, List<String> words, int width, int height) {
        if (embedding.dimensions() < 2) {
            throw new IllegalArgumentException("Scatter plot needs at least 2 dimensions, got "
                + embedding.dimensions());
        }
        if (width <= 2 * MARGIN || height <= 2 * MARGIN) {
            throw new IllegalArgumentException("Plot is too small: " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.points = new ArrayList<>(words.size());
        for (String word : words) {
            double[] v = embedding.vector(word);
            points.add(new Point(word, v[0], v[1]));
        }
    }

    public String toSVG() {
        double minX = Double.POSITIVE_INFINITY, maxX = Double.NEGATIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY, maxY = Double.NEGATIVE_INFINITY;
        for (Point p : points) {
            minX = Math.min(minX, p.x);
            maxX = Math.max(maxX, p.x);
            minY = Math.min(minY, p.y);
            maxY = Math.max(maxY, p.y);
        }
        double rangeX = maxX - minX;
        double rangeY = maxY - minY;
        if (rangeX == 0) rangeX = 1;
        if (rangeY == 0) rangeY = 1;

        double plotW = width - 2 * MARGIN;
        double plotH = height - 2 * MARGIN;

        StringBuilder svg = new StringBuilder();
        svg.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n");
        svg.append(String.format(Locale.ROOT, "<svg xmlns=\"http://www.w3.org/2000/svg\" width=\"%d\" height=\"%d\" viewBox=\"0 0 %d %d\">\n",
            width, height, width, height));

        svg.append("  <defs>\n");
        svg.append("    <style>\n");
        svg.append("      .background { fill: #fafafa; }\n");
        svg.append("      .axis { stroke: #cccccc; stroke-width: 1; }\n");
        svg.append("      .point { fill: #c0392b; stroke: white; stroke-width: 1; }\n");
        svg.append("      .label { font-family: sans-serif; font-size: 12px; fill: #333; }\n");
        svg.append("    </style>\n");
        svg.append("  </defs>\n\n");

        svg.append(String.format(Locale.ROOT, "  <rect class=\"background\" width=\"%d\" height=\"%d\"/>\n\n", width, height));

        // Axes through the origin when it is inside the plotted range
        svg.append("  <g id=\"axes\">\n");
        if (minX <= 0 && maxX >= 0) {
            double x0 = MARGIN + (0 - minX) / rangeX * plotW;
            svg.append(String.format(Locale.ROOT, "    <line class=\"axis\" x1=\"%.2f\" y1=\"%.2f\" x2=\"%.2f\" y2=\"%.2f\"/>\n",
                x0, MARGIN, x0, height - MARGIN));
        }
        if (minY <= 0 && maxY >= 0) {
            double y0 = height - MARGIN - (0 - minY) / rangeY * plotH;
            svg.append(String.format(Locale.ROOT, "    <line class=\"axis\" x1=\"%.2f\" y1=\"%.2f\" x2=\"%.2f\" y2=\"%.2f\"/>\n",
                MARGIN, y0, width - MARGIN, y0));
        }
        svg.append("  </g>\n\n");

        svg.append("  <g id=\"points\">\n");
        for (Point p : points) {
            double cx = MARGIN + (p.x - minX) / rangeX * plotW;
            double cy = height - MARGIN - (p.y - minY) / rangeY * plotH;   // SVG y grows downwards
            svg.append(String.format(Locale.ROOT, "    <circle class=\"point\" cx=\"%.2f\" cy=\"%.2f\" r=\"4.00\"/>\n", cx, cy));
            svg.append(String.format(Locale.ROOT, "    <text class=\"label\" x=\"%.2f\" y=\"%.2f\">%s</text>\n",
                cx + 6, cy - 6, escapeXml(p.word)));
        }
        svg.append("  </g>\n");

        svg.append("</svg>");
        return svg.toString();
    }

    private static String escapeXml(String s) {
        return s.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\"", "&quot;")
                .replace("'", "&apos;");
    }
}
