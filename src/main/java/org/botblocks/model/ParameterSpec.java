package org.botblocks.model;

/**
 * Declares one parameter slot of a block type together with its inclusive valid range.
 *
 * @param name Human readable name of the slot, used in error messages and the block listing.
 * @param min  Smallest accepted value.
 * @param max  Largest accepted value.
 */
public record ParameterSpec(String name, int min, int max) {

    public ParameterSpec {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Parameter name must not be blank");
        }
        if (min > max) {
            throw new IllegalArgumentException("Invalid range for parameter '" + name + "': " + min + ".." + max);
        }
    }

    /**
     * @param value The value to check.
     * @return {@code true} if the value lies within {@code min..max}.
     */
    public boolean accepts(int value) {
        return value >= min && value <= max;
    }

    @Override
    public String toString() {
        return name + "[" + min + ".." + max + "]";
    }
}
