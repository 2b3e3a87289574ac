/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.musicxml.importer;

import net.scoreworks.musicxml.model.Layer;
import net.scoreworks.musicxml.model.Measure;
import net.scoreworks.musicxml.model.Staff;
import nu.xom.Element;
import org.apache.commons.lang3.StringUtils;

/**
 * Resolves the staff and voice numbers of a note, backup or forward element onto a {@link Layer} of the measure
 * being read, creating the layer on first use.
 */
public class LayerSelector {

    /** pass as voice number to select the first existing layer */
    public static final int FIRST_LAYER = -1;

    private final ImportWarnings warnings;

    public LayerSelector(ImportWarnings warnings) {
        this.warnings = warnings;
    }

    /**
     * Select by the &lt;staff&gt; and &lt;voice&gt; children of the element. The staff number is local to the part
     */
    public Layer select(Element node, Measure measure) {
        String staffStr = XmlNodes.childValue(node, "staff");
        int staffNum = staffStr.isEmpty() ? 1 : XmlNodes.toInt(staffStr);
        Staff staff = staffOf(staffNum, measure);

        String voiceStr = XmlNodes.childValue(node, "voice");
        if (StringUtils.isEmpty(voiceStr))
            return select(FIRST_LAYER, staff);
        int layerNum = XmlNodes.toInt(voiceStr);
        if (layerNum < 1) {
            warnings.warn("Voice {} cannot be found in staff {}", voiceStr, staff.getN());
            layerNum = 1;
        }
        return select(layerNum, staff);
    }

    /**
     * @return the first layer of the staff with the given part-local number
     */
    public Layer select(int staffNum, Measure measure) {
        return select(FIRST_LAYER, staffOf(staffNum, measure));
    }

    /**
     * @param layerNum voice number or {@link #FIRST_LAYER}
     */
    public Layer select(int layerNum, Staff staff) {
        Layer layer;
        if (layerNum == FIRST_LAYER) {
            layer = staff.getFirstLayer();
            layerNum = 1;
        }
        else {
            layer = staff.getLayer(layerNum);
        }
        if (layer != null)
            return layer;
        return new Layer(staff, layerNum);
    }

    /**
     * @return the staff with the part-local number, or the first staff if the number is out of range
     */
    public Staff staffOf(int staffNum, Measure measure) {
        if (staffNum < 1 || staffNum > measure.getStaffCount()) {
            warnings.warn("Staff {} cannot be found", staffNum);
            staffNum = 1;
        }
        return measure.getStaff(staffNum - 1);
    }
}
