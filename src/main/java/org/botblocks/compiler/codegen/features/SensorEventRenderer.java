package org.botblocks.compiler.codegen.features;

import org.botblocks.compiler.codegen.HandlerSignature;
import org.botblocks.compiler.codegen.IEventRenderer;
import org.botblocks.model.Block;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders sensor events whose parameters each hold one sensor's expected reading:
 * 0 means don't care and is omitted, 1 and 2 select the two readings.
 */
public class SensorEventRenderer implements IEventRenderer {

    private final String eventName;
    private final String sensorArray;
    private final String firstReading;
    private final String secondReading;

    /**
     * @param eventName     Target event name.
     * @param sensorArray   Name of the sensor array in bindings.
     * @param firstReading  Label of parameter value 1.
     * @param secondReading Label of parameter value 2.
     */
    public SensorEventRenderer(String eventName, String sensorArray, String firstReading, String secondReading) {
        this.eventName = eventName;
        this.sensorArray = sensorArray;
        this.firstReading = firstReading;
        this.secondReading = secondReading;
    }

    @Override
    public HandlerSignature signature(Block event) {
        List<String> bindings = new ArrayList<>();
        for (int i = 0; i < event.parameters().size(); i++) {
            int reading = event.parameter(i);
            if (reading == 0) {
                continue;
            }
            bindings.add(sensorArray + "[" + i + "]=" + (reading == 1 ? firstReading : secondReading));
        }
        return new HandlerSignature(eventName, bindings);
    }
}
