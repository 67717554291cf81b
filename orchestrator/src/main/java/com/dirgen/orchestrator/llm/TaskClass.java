package com.dirgen.orchestrator.llm;

import com.dirgen.orchestrator.model.ProtocolException;

import java.util.Arrays;

/**
 * What a worker is asking the model to do. Drives candidate ordering and
 * whether the answer may be cached.
 */
public enum TaskClass {
    PLANNING          ("planning",           false, false),
    COMPLEX_GENERATION("complex_generation", false, false),
    ARCHITECTURE      ("architecture",       false, false),
    VERIFICATION      ("verification",       true,  false),
    VALIDATION        ("validation",         true,  false),
    SIMPLE_GENERATION ("simple_generation",  true,  true),
    GENERAL           ("general",            false, false);

    private final String  wireName;
    private final boolean cacheable;
    private final boolean localFirst;

    TaskClass(String wireName, boolean cacheable, boolean localFirst) {
        this.wireName   = wireName;
        this.cacheable  = cacheable;
        this.localFirst = localFirst;
    }

    public String  wireName()   { return wireName; }
    public boolean cacheable()  { return cacheable; }
    public boolean localFirst() { return localFirst; }

    /** Blank means {@link #GENERAL}; an unknown name is a protocol error. */
    public static TaskClass fromWire(String value) {
        if (value == null || value.isBlank()) {
            return GENERAL;
        }
        String normalized = value.strip().toLowerCase().replace('-', '_');
        return Arrays.stream(values())
                .filter(t -> t.wireName.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new ProtocolException("Unknown task class: '" + value + "'"));
    }
}
