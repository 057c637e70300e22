package io.hearthwarrio.ariasense.webdriver;

import io.hearthwarrio.ariasense.core.ElementDescription;
import io.hearthwarrio.ariasense.core.ElementMatch;

import java.util.Objects;

/**
 * Default stdout logger for resolved elements.
 */
public final class StdOutResolvedElementLogger implements ResolvedElementLogger {

    private final LogDetail detail;

    public StdOutResolvedElementLogger(LogDetail detail) {
        this.detail = Objects.requireNonNull(detail, "detail must not be null");
    }

    @Override
    public LogDetail detail() {
        return detail;
    }

    @Override
    public void logResolvedElement(String target, ElementMatch match, ElementDescription description) {
        System.out.println(format(target, match, description, detail));
    }

    /**
     * Single-line rendering shared with other text loggers.
     */
    static String format(String target, ElementMatch match, ElementDescription description, LogDetail detail) {
        StringBuilder sb = new StringBuilder(256);
        sb.append("[ariasense] target='").append(safe(target)).append('\'');

        if (description != null) {
            sb.append(", role=").append(description.getRole());
        } else if (match != null) {
            sb.append(", role=").append(match.getRole());
        }
        if (detail == LogDetail.NONE) {
            return sb.toString();
        }

        String name = description != null ? description.getName() : match != null ? match.getAccessibleName() : "";
        sb.append(", name='").append(name).append('\'');

        if (detail == LogDetail.FULL && description != null) {
            sb.append(", hidden=").append(description.isHidden())
                    .append(", disabled=").append(description.isDisabled())
                    .append(", checked=").append(description.getChecked())
                    .append(", pressed=").append(description.getPressed())
                    .append(", expanded=").append(description.getExpanded())
                    .append(", selected=").append(description.isSelected());
            if (description.getLevel() > 0) {
                sb.append(", level=").append(description.getLevel());
            }
        }
        return sb.toString();
    }

    private static String safe(String s) {
        return s == null ? "" : s;
    }
}
