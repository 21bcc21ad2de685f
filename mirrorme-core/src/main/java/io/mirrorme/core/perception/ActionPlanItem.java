package io.mirrorme.core.perception;

import java.util.List;

public record ActionPlanItem(String category, String priority, List<String> actions) {
    public ActionPlanItem {
        actions = actions == null ? List.of() : List.copyOf(actions);
    }
}
