package com.parkingrules.engine.model;

/**
 * Inclusive street-number interval attached to one side of a centerline.
 *
 * Municipal ranges follow the odd/even convention: when both ends share parity the range
 * only holds numbers of that parity. Ranges may be digitized descending.
 *
 * @param fromAddress first address number as surveyed
 * @param toAddress   last address number as surveyed
 */
public record AddressRange(int fromAddress, int toAddress) {

    public AddressRange {
        if (fromAddress < 0 || toAddress < 0) {
            throw new IllegalArgumentException(
                "Address numbers must be >= 0: [" + fromAddress + ", " + toAddress + "]");
        }
    }

    public int low() {
        return Math.min(fromAddress, toAddress);
    }

    public int high() {
        return Math.max(fromAddress, toAddress);
    }

    /**
     * True when the range contains {@code addressNumber}, honouring the parity convention.
     */
    public boolean contains(int addressNumber) {
        if (addressNumber < low() || addressNumber > high()) {
            return false;
        }
        if (isSingleParity()) {
            return Math.floorMod(addressNumber, 2) == Math.floorMod(fromAddress, 2);
        }
        return true;
    }

    public boolean isSingleParity() {
        return Math.floorMod(fromAddress, 2) == Math.floorMod(toAddress, 2);
    }

    @Override
    public String toString() {
        return fromAddress + "-" + toAddress;
    }
}
