package com.cburch.logicsim.network;

import java.util.List;

/**
 * A cycle that did not settle.
 *
 * @param passes number of propagation passes attempted
 * @param unstableDevices ids of the devices whose outputs still changed in the last pass
 */
public record Oscillation(int passes, List<Integer> unstableDevices) {
    public Oscillation {
        unstableDevices = List.copyOf(unstableDevices);
    }
}
