package com.klrdim.quiver;

import com.klrdim.common.UnknownCartanTypeException;

/**
 * Source of Cartan data. The only seam through which the evaluation reads
 * adjacency and symmetrizing scalars.
 */
public interface QuiverDataProvider {

    /**
     * @throws UnknownCartanTypeException if the descriptor is not supported
     */
    Quiver resolve(CartanType type);

    default Quiver resolve(String descriptor) {
        return resolve(CartanType.parse(descriptor));
    }
}
