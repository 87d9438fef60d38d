package com.phillippitts.erasemark.service.mask;

import com.phillippitts.erasemark.config.inpaint.MaskProperties;
import com.phillippitts.erasemark.domain.Region;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;

/**
 * Discards detector output that is unlikely to be a watermark.
 *
 * <p>Regions narrower or shorter than the configured minimum are noise; regions covering a
 * large share of the frame are real content. Survivors are ranked by confidence and capped.
 */
@Component
public class RegionFilter {
    private static final Logger LOG = LogManager.getLogger(RegionFilter.class);

    private final MaskProperties props;

    public RegionFilter(MaskProperties props) {
        this.props = props;
    }

    public List<Region> filter(List<Region> regions, int imageWidth, int imageHeight) {
        if (regions == null || regions.isEmpty()) {
            return List.of();
        }
        double imageArea = (double) imageWidth * imageHeight;
        List<Region> kept = regions.stream()
                .filter(r -> r.width() >= props.minRegionWidth() && r.height() >= props.minRegionHeight())
                .filter(r -> imageArea > 0 && r.area() / imageArea <= props.maxAreaFraction())
                .sorted(Comparator.comparingDouble(Region::confidence).reversed())
                .limit(props.maxRegions())
                .toList();
        if (kept.size() != regions.size()) {
            LOG.debug("Region filter kept {} of {} regions (image={}x{})",
                    kept.size(), regions.size(), imageWidth, imageHeight);
        }
        return kept;
    }
}
