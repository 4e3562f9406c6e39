package com.pagesmith.core.renderer.impl;

import com.pagesmith.core.renderer.BodyRenderer;

import java.util.Set;

/**
 * Renderer that passes body text through unchanged.
 *
 * <p>Default renderer when no other one is configured or matches the file.
 */
public class PlainRenderer implements BodyRenderer {

    public static final String ID = "plain";

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getDisplayName() {
        return "Plain Text Renderer";
    }

    @Override
    public Set<String> getExtensions() {
        return Set.of("txt", "text");
    }

    @Override
    public String render(String text) {
        return text;
    }

    @Override
    public String toString() {
        return ID;
    }
}
