package github.sarthakdev143.photo_forge.service;

import github.sarthakdev143.photo_forge.model.AdjustmentSet;

import java.awt.image.BufferedImage;

public interface AdjustmentPipeline {

    /**
     * Applies every non-identity stage of {@code adjustments} to {@code source} in the fixed stage
     * order. The source image is never modified; with the identity adjustment it is returned as is.
     */
    BufferedImage apply(BufferedImage source, AdjustmentSet adjustments);
}
