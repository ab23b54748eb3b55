package com.example.FinSolve.access;

import com.example.FinSolve.model.DepartmentTag;
import com.example.FinSolve.model.Role;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Static role to department visibility table.
 * Built once at startup and read-only afterwards, so it is shared without locking.
 */
@Component
public class RoleAccessPolicy {

    private final Map<Role, Set<DepartmentTag>> accessTable;

    public RoleAccessPolicy() {
        Map<Role, Set<DepartmentTag>> table = new EnumMap<>(Role.class);
        for (Role role : Role.values()) {
            table.put(role, Collections.unmodifiableSet(departmentsFor(role)));
        }
        this.accessTable = Collections.unmodifiableMap(table);
    }

    /**
     * Departments whose fragments the given role may see. "general" is always included.
     */
    public Set<DepartmentTag> allowedDepartments(Role role) {
        Objects.requireNonNull(role, "role");
        return accessTable.get(role);
    }

    /**
     * Same as {@link #allowedDepartments(Role)}, in declaration order for API responses.
     */
    public List<DepartmentTag> accessibleDepartments(Role role) {
        return List.copyOf(EnumSet.copyOf(allowedDepartments(role)));
    }

    public boolean canAccess(Role role, DepartmentTag department) {
        return allowedDepartments(role).contains(department);
    }

    private static EnumSet<DepartmentTag> departmentsFor(Role role) {
        return switch (role) {
            case C_LEVEL -> EnumSet.allOf(DepartmentTag.class);
            case EMPLOYEE -> EnumSet.of(DepartmentTag.GENERAL);
            case FINANCE -> EnumSet.of(DepartmentTag.GENERAL, DepartmentTag.FINANCE);
            case MARKETING -> EnumSet.of(DepartmentTag.GENERAL, DepartmentTag.MARKETING);
            case HR -> EnumSet.of(DepartmentTag.GENERAL, DepartmentTag.HR);
            case ENGINEERING -> EnumSet.of(DepartmentTag.GENERAL, DepartmentTag.ENGINEERING);
        };
    }
}
