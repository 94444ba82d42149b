package com.darkyen.libgdx.paragraph;

import com.badlogic.gdx.files.FileHandle;
import com.badlogic.gdx.utils.GdxRuntimeException;
import com.badlogic.gdx.utils.JsonReader;
import com.badlogic.gdx.utils.JsonValue;
import com.darkyen.libgdx.paragraph.hyphenation.Hyphenator;

/**
 * User facing options of paragraph layout.
 *
 * <h4>JSON form</h4>
 * <blockquote><pre>{@code
 * {
 *     "alignment": "justified",
 *     "hyphenation": true,
 *     "extraParagraphSpacing": false,
 *     "viewportWidth": 480,
 *     "language": "en-US"
 * }
 * }</pre></blockquote>
 * All keys are optional, missing keys keep their defaults.
 */
public class ParagraphSettings {

    private TextAlignment alignment = TextAlignment.JUSTIFIED;
    private boolean hyphenationEnabled = false;
    private boolean extraParagraphSpacing = true;
    private int viewportWidth = 0;
    private String language = "";

    /** <i>Default: {@link TextAlignment#JUSTIFIED}</i> */
    public TextAlignment getAlignment() {
        return alignment;
    }

    /** @param alignment not null */
    public ParagraphSettings setAlignment(TextAlignment alignment) {
        if (alignment == null) throw new NullPointerException("alignment");
        this.alignment = alignment;
        return this;
    }

    /** True selects greedy line breaking which splits words at hyphenation points,
     * false selects line breaking that minimizes raggedness and splits only words wider than the viewport.
     * <i>Default: false</i> */
    public boolean isHyphenationEnabled() {
        return hyphenationEnabled;
    }

    public ParagraphSettings setHyphenationEnabled(boolean hyphenationEnabled) {
        this.hyphenationEnabled = hyphenationEnabled;
        return this;
    }

    /** When paragraphs are separated by extra vertical space, their first line is not indented.
     * <i>Default: true</i> */
    public boolean isExtraParagraphSpacing() {
        return extraParagraphSpacing;
    }

    public ParagraphSettings setExtraParagraphSpacing(boolean extraParagraphSpacing) {
        this.extraParagraphSpacing = extraParagraphSpacing;
        return this;
    }

    /** Width available for lines, in layout units. <i>Default: 0</i> */
    public int getViewportWidth() {
        return viewportWidth;
    }

    /** @param viewportWidth must not be negative */
    public ParagraphSettings setViewportWidth(int viewportWidth) {
        if (viewportWidth < 0) throw new IllegalArgumentException("viewportWidth = " + viewportWidth + ", must be >= 0");
        this.viewportWidth = viewportWidth;
        return this;
    }

    /** BCP-47 tag of the text language, used for hyphenation patterns. <i>Default: empty</i> */
    public String getLanguage() {
        return language;
    }

    /** @param language may be null for none */
    public ParagraphSettings setLanguage(String language) {
        this.language = language == null ? "" : language;
        return this;
    }

    /**
     * Overwrite settings with values present in the JSON object.
     * @throws GdxRuntimeException on invalid values
     */
    public ParagraphSettings load(JsonValue json) {
        if (json == null) throw new NullPointerException("json");
        if (!json.isObject()) throw new GdxRuntimeException("Paragraph settings must be an object, got " + json.type());

        final String alignmentName = json.getString("alignment", null);
        if (alignmentName != null) {
            final TextAlignment alignment = TextAlignment.forName(alignmentName);
            if (alignment == null) throw new GdxRuntimeException("Unknown alignment: " + alignmentName);
            setAlignment(alignment);
        }
        setHyphenationEnabled(json.getBoolean("hyphenation", hyphenationEnabled));
        setExtraParagraphSpacing(json.getBoolean("extraParagraphSpacing", extraParagraphSpacing));
        final int viewportWidth = json.getInt("viewportWidth", this.viewportWidth);
        if (viewportWidth < 0) throw new GdxRuntimeException("Invalid viewportWidth: " + viewportWidth);
        setViewportWidth(viewportWidth);
        setLanguage(json.getString("language", language));
        return this;
    }

    /** @see #load(JsonValue) */
    public static ParagraphSettings fromJson(String json) {
        return new ParagraphSettings().load(new JsonReader().parse(json));
    }

    /** @see #load(JsonValue) */
    public static ParagraphSettings fromJson(FileHandle file) {
        return new ParagraphSettings().load(new JsonReader().parse(file));
    }

    /** @return new hyphenator for {@link #getLanguage()}, in fallback-only mode when the language is not supported */
    public Hyphenator createHyphenator() {
        final Hyphenator hyphenator = new Hyphenator();
        hyphenator.setPreferredLanguage(language);
        return hyphenator;
    }

    @Override
    public String toString() {
        return "ParagraphSettings{" +
                "alignment=" + alignment +
                ", hyphenationEnabled=" + hyphenationEnabled +
                ", extraParagraphSpacing=" + extraParagraphSpacing +
                ", viewportWidth=" + viewportWidth +
                ", language='" + language + '\'' +
                '}';
    }
}
