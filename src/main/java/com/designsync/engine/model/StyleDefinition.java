package com.designsync.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StyleDefinition {
    private String key;
    private String name;
    private String styleType; // FILL, TEXT, EFFECT, GRID
    private String description;
}
