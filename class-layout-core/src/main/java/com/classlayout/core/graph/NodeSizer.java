package com.classlayout.core.graph;

import com.classlayout.core.config.ClassLayoutConfig;
import com.classlayout.core.layout.Size;
import com.classlayout.core.model.Classifier;
import com.classlayout.core.model.Member;

import java.util.List;
import java.util.Objects;

/**
 * Estimates box sizes from classifier text using fixed character metrics.
 *
 * <p>Width is the widest of the name line and the member lines, plus padding on both sides,
 * floored at {@link ClassLayoutConfig#minClassWidth()}. Height is the header plus one line
 * per member, with one extra padding per non-empty compartment, floored at
 * {@link ClassLayoutConfig#minClassHeight()}.
 */
public final class NodeSizer {

    private final ClassLayoutConfig config;

    public NodeSizer(ClassLayoutConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /**
     * Computes the box size for a classifier.
     *
     * @param classifier classifier to measure
     * @return box size
     */
    public Size sizeOf(Classifier classifier) {
        double padding = config.classPadding() * 2;
        double nameWidth = textWidth(classifier.name()) + padding;

        double widestField = widest(classifier.fields(), true);
        double widestMethod = widest(classifier.methods(), false);
        double contentWidth = Math.max(widestField, widestMethod) + padding;

        double width = Math.max(Math.max(nameWidth, contentWidth), config.minClassWidth());
        double height = config.classHeaderHeight()
            + compartmentHeight(classifier.fields().size())
            + compartmentHeight(classifier.methods().size());

        return new Size(width, Math.max(height, config.minClassHeight()));
    }

    /**
     * Size used for phantom nodes.
     *
     * @return minimum box size
     */
    public Size phantomSize() {
        return new Size(config.minClassWidth(), config.minClassHeight());
    }

    /**
     * Sizing text of a field: visibility, name and optional {@code : type}.
     *
     * @param field field member
     * @return measured text
     */
    static String fieldLine(Member field) {
        String base = field.visibility().symbol() + field.name();
        return field.type() == null || field.type().isBlank() ? base : base + ": " + field.type();
    }

    /**
     * Sizing text of a method: visibility, name and {@code ()}.
     *
     * @param method method member
     * @return measured text
     */
    static String methodLine(Member method) {
        return method.visibility().symbol() + method.name() + "()";
    }

    double textWidth(String text) {
        return text.codePointCount(0, text.length()) * config.charWidth();
    }

    private double widest(List<Member> members, boolean fields) {
        double max = 0;
        for (Member member : members) {
            String line = fields ? fieldLine(member) : methodLine(member);
            max = Math.max(max, textWidth(line));
        }
        return max;
    }

    private double compartmentHeight(int lines) {
        return lines == 0 ? 0 : lines * config.lineHeight() + config.classPadding();
    }
}
