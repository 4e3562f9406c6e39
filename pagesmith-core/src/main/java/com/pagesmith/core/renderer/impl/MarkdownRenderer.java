package com.pagesmith.core.renderer.impl;

import com.pagesmith.core.renderer.BodyRenderer;
import org.commonmark.node.Node;
import org.commonmark.parser.Parser;
import org.commonmark.renderer.html.HtmlRenderer;

import java.util.Set;

/**
 * Renderer for CommonMark Markdown.
 *
 * <p>Parser and HTML renderer are immutable and shared by all pages.
 */
public class MarkdownRenderer implements BodyRenderer {

    public static final String ID = "markdown";

    private static final Parser PARSER = Parser.builder().build();
    private static final HtmlRenderer RENDERER = HtmlRenderer.builder().build();

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getDisplayName() {
        return "Markdown Renderer (CommonMark)";
    }

    @Override
    public Set<String> getExtensions() {
        return Set.of("md", "markdown", "mkd");
    }

    @Override
    public String render(String text) {
        Node document = PARSER.parse(text);
        return RENDERER.render(document);
    }

    @Override
    public String toString() {
        return ID;
    }
}
