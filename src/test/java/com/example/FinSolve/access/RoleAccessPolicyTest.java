package com.example.FinSolve.access;

import com.example.FinSolve.model.DepartmentTag;
import com.example.FinSolve.model.Role;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RoleAccessPolicyTest {

    private final RoleAccessPolicy policy = new RoleAccessPolicy();

    @Test
    @DisplayName("C-Level sees every department")
    void cLevelSeesEverything() {
        assertThat(policy.allowedDepartments(Role.C_LEVEL))
                .containsExactlyInAnyOrder(DepartmentTag.values());
    }

    @Test
    @DisplayName("Employee only sees general")
    void employeeSeesGeneralOnly() {
        assertThat(policy.allowedDepartments(Role.EMPLOYEE)).containsExactly(DepartmentTag.GENERAL);
    }

    @Test
    void departmentRolesSeeGeneralAndOwnDepartment() {
        assertThat(policy.allowedDepartments(Role.FINANCE))
                .containsExactlyInAnyOrder(DepartmentTag.GENERAL, DepartmentTag.FINANCE);
        assertThat(policy.allowedDepartments(Role.MARKETING))
                .containsExactlyInAnyOrder(DepartmentTag.GENERAL, DepartmentTag.MARKETING);
        assertThat(policy.allowedDepartments(Role.HR))
                .containsExactlyInAnyOrder(DepartmentTag.GENERAL, DepartmentTag.HR);
        assertThat(policy.allowedDepartments(Role.ENGINEERING))
                .containsExactlyInAnyOrder(DepartmentTag.GENERAL, DepartmentTag.ENGINEERING);
    }

    @ParameterizedTest
    @EnumSource(Role.class)
    void generalIsVisibleToEveryRole(Role role) {
        assertThat(policy.canAccess(role, DepartmentTag.GENERAL)).isTrue();
    }

    @Test
    void marketingCannotSeeFinance() {
        assertThat(policy.canAccess(Role.MARKETING, DepartmentTag.FINANCE)).isFalse();
        assertThat(policy.canAccess(Role.FINANCE, DepartmentTag.MARKETING)).isFalse();
    }

    @Test
    void accessibleDepartmentsAreInDeclarationOrder() {
        assertThat(policy.accessibleDepartments(Role.FINANCE))
                .containsExactly(DepartmentTag.FINANCE, DepartmentTag.GENERAL);
        assertThat(policy.accessibleDepartments(Role.C_LEVEL))
                .isEqualTo(List.of(DepartmentTag.values()));
    }

    @Test
    void accessTableIsReadOnly() {
        Set<DepartmentTag> allowed = policy.allowedDepartments(Role.EMPLOYEE);
        assertThatThrownBy(() -> allowed.add(DepartmentTag.FINANCE))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThat(policy.allowedDepartments(Role.EMPLOYEE)).isEqualTo(EnumSet.of(DepartmentTag.GENERAL));
    }

    @Test
    void nullRoleFailsFast() {
        assertThatThrownBy(() -> policy.allowedDepartments(null))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void roleLabelsParseLeniently() {
        assertThat(Role.fromLabel("c-level")).isEqualTo(Role.C_LEVEL);
        assertThat(Role.fromLabel("C_Level")).isEqualTo(Role.C_LEVEL);
        assertThat(Role.fromLabel(" Finance ")).isEqualTo(Role.FINANCE);
        assertThatThrownBy(() -> Role.fromLabel("intern"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void malformedDepartmentTagIsRejected() {
        assertThat(DepartmentTag.fromLabel("HR")).isEqualTo(DepartmentTag.HR);
        assertThatThrownBy(() -> DepartmentTag.fromLabel("legal"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DepartmentTag.fromLabel(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
