package org.dxworks.codedigest.model;

import java.util.Objects;

public final class Variable {
    public static final String MALFORMED = "malformed";

    private final String name;
    private final int level;
    private final int line;
    private final String section;
    private final String picture;
    private final String usage;
    private final Integer occurs;
    private final String redefines;
    private final String category;

    public Variable(String name, int level, int line, String section, String picture, String usage,
                    Integer occurs, String redefines, String category) {
        this.name = Objects.requireNonNull(name, "name");
        this.level = level;
        this.line = line;
        this.section = section;
        this.picture = picture;
        this.usage = usage;
        this.occurs = occurs;
        this.redefines = redefines;
        this.category = Objects.requireNonNull(category, "category");
    }

    public String getName() {
        return name;
    }

    public int getLevel() {
        return level;
    }

    public int getLine() {
        return line;
    }

    public String getSection() {
        return section;
    }

    public String getPicture() {
        return picture;
    }

    public String getUsage() {
        return usage;
    }

    public Integer getOccurs() {
        return occurs;
    }

    public String getRedefines() {
        return redefines;
    }

    public String getCategory() {
        return category;
    }

    public boolean isMalformed() {
        return MALFORMED.equals(category);
    }
}
