package com.beancount.render.ast;

import java.util.Objects;

public final class PluginDirectiveNode extends DirectiveNode {

    private final String module;
    private final String config;

    public PluginDirectiveNode(SourceLocation location, String module, String config) {
        super(location);
        this.module = Objects.requireNonNull(module, "module");
        this.config = config;
    }

    public String getModule() {
        return module;
    }

    /** Plugin configuration string, or {@code null} when the plugin takes none. */
    public String getConfig() {
        return config;
    }

    @Override
    public String getDirectiveType() {
        return "plugin";
    }

    @Override
    public <R, X extends Exception> R accept(DirectiveVisitor<R, X> visitor) throws X {
        return visitor.visitPlugin(this);
    }
}
