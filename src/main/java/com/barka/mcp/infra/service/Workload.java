package com.barka.mcp.infra.service;

import com.barka.mcp.infra.db.StoredEntity;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A member's load, derived from the open tasks assigned to them. Utilization is not capped, so
 * overallocated members stay comparable.
 */
record Workload(int currentTasks, double totalHoursAllocated, int utilizationPercentage, double hoursPerWeek) {

    static Workload of(StoredEntity member, List<StoredEntity> tasks) {
        int count = 0;
        double hours = 0;
        for (StoredEntity t : tasks) {
            if (member.id().equals(AbstractDocumentService.str(t.body(), "assignedTo"))
                    && AbstractDocumentService.isOpen(t)) {
                count++;
                hours += AbstractDocumentService.number(t.body().get("estimatedHours"), 0);
            }
        }
        double perWeek = AbstractDocumentService.hoursPerWeek(member.body());
        int utilization = (int) Math.round(hours / perWeek * 100);
        return new Workload(count, hours, utilization, perWeek);
    }

    double remainingHours() {
        return hoursPerWeek - totalHoursAllocated;
    }

    String availabilityStatus() {
        if (utilizationPercentage >= 100) return "fully_allocated";
        if (utilizationPercentage >= 80) return "mostly_allocated";
        if (utilizationPercentage >= 50) return "partially_allocated";
        return "available";
    }

    Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("currentTasks", currentTasks);
        m.put("totalHoursAllocated", totalHoursAllocated);
        m.put("utilizationPercentage", utilizationPercentage);
        return m;
    }
}
