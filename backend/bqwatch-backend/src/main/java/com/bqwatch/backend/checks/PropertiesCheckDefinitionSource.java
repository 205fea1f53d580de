package com.bqwatch.backend.checks;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

public class PropertiesCheckDefinitionSource implements CheckDefinitionSource {

    private final CheckDefinitionProperties properties;

    public PropertiesCheckDefinitionSource(CheckDefinitionProperties properties) {
        this.properties = properties;
    }

    @Override
    public List<CheckDefinition> load() {
        List<CheckDefinition> definitions = new ArrayList<>();
        int row = 1;
        for (CheckDefinitionProperties.Definition definition : properties.getDefinitions()) {
            List<String> recipients = definition.getRecipients().stream()
                    .filter(address -> address != null && !address.isBlank())
                    .map(String::trim)
                    .collect(Collectors.toList());
            definitions.add(new CheckDefinition(row++, definition.getTitle(), definition.getSql(), recipients));
        }
        return definitions;
    }

    @Override
    public String describe() {
        return "bqwatch.checks.definitions";
    }
}
