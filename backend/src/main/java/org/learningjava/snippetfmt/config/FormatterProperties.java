package org.learningjava.snippetfmt.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "snippetfmt.format")
public class FormatterProperties {
    private int width = 79;
    private String commentMarker = "#";
    private String commentToken = "# ";
    private String indent = "    ";

    public int getWidth() { return width; }
    public void setWidth(int v) { this.width = v; }
    public String getCommentMarker() { return commentMarker; }
    public void setCommentMarker(String v) { this.commentMarker = v; }
    public String getCommentToken() { return commentToken; }
    public void setCommentToken(String v) { this.commentToken = v; }
    public String getIndent() { return indent; }
    public void setIndent(String v) { this.indent = v; }
}
