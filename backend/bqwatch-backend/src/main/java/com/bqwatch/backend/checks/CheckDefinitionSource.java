package com.bqwatch.backend.checks;

import java.util.List;

public interface CheckDefinitionSource {

    /**
     * All definitions in source order, including blank rows.
     */
    List<CheckDefinition> load();

    /**
     * Human readable location of the definitions, quoted in alert messages.
     */
    String describe();
}
