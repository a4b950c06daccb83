package com.ttennebkram.imagelab.render;

import com.ttennebkram.imagelab.raster.RasterBuffer;

/**
 * A labelled side-by-side image: a label strip on top, the original on the
 * left and the reconciled derived image on the right.
 */
public final class ComparisonArtifact implements AutoCloseable {

    private final RasterBuffer image;
    private final int labelStripHeight;
    private final int panelWidth;

    ComparisonArtifact(RasterBuffer image, int labelStripHeight, int panelWidth) {
        this.image = image;
        this.labelStripHeight = labelStripHeight;
        this.panelWidth = panelWidth;
    }

    public RasterBuffer getImage() {
        return image;
    }

    public int getLabelStripHeight() {
        return labelStripHeight;
    }

    /**
     * Width of each half, equal to the source width.
     */
    public int getPanelWidth() {
        return panelWidth;
    }

    @Override
    public void close() {
        image.close();
    }
}
