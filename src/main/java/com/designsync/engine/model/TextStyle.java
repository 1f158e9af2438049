package com.designsync.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TextStyle {

    public enum HorizontalAlign { LEFT, CENTER, RIGHT, JUSTIFIED }

    public enum VerticalAlign { TOP, CENTER, BOTTOM }

    public enum TextCase { ORIGINAL, UPPER, LOWER, TITLE }

    public enum Decoration { NONE, UNDERLINE, STRIKETHROUGH }

    private String fontFamily;
    private String fontPostScriptName;
    private double fontSize;
    private double fontWeight;
    @Builder.Default
    private HorizontalAlign horizontalAlign = HorizontalAlign.LEFT;
    @Builder.Default
    private VerticalAlign verticalAlign = VerticalAlign.TOP;
    private double letterSpacing;
    private double lineHeight;
    private RgbaColor color;
    @Builder.Default
    private TextCase textCase = TextCase.ORIGINAL;
    @Builder.Default
    private Decoration decoration = Decoration.NONE;
    private String autoResize; // WIDTH_AND_HEIGHT, HEIGHT, NONE
}
