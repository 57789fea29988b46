// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.datasets.grid;

import java.util.Locale;

import static com.google.common.base.Preconditions.checkArgument;

/// Linear transform from values as stored (unscaled) to values as presented (scaled), as used by
/// NetCDF scale_factor/add_offset attributes and packed HDF data: scaled = raw * scale + offset.
public record Scaling (double scale, double offset) {

    public static final Scaling IDENTITY = new Scaling(1, 0);

    public Scaling {
        checkArgument(Double.isFinite(scale) && scale != 0, "Scale factor must be finite and nonzero.");
        checkArgument(Double.isFinite(offset), "Offset must be finite.");
    }

    public double scale (double raw) {
        return raw * scale + offset;
    }

    public double unscale (double scaled) {
        return (scaled - offset) / scale;
    }

    public boolean isIdentity () {
        return scale == 1 && offset == 0;
    }

    public String canonical () {
        return String.format(Locale.ROOT, "%.17g*x+%.17g", scale, offset);
    }
}
