package com.queryroute.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Root of the sources YAML document.
 */
@Data
public class SourcesFile {
    private List<SourceDefinition> sources = new ArrayList<>();
}
