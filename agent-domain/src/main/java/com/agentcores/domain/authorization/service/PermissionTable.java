package com.agentcores.domain.authorization.service;

import com.agentcores.types.enums.CapabilityEnum;
import com.agentcores.types.enums.UserRoleEnum;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static com.agentcores.types.enums.CapabilityEnum.CANCEL_TASKS;
import static com.agentcores.types.enums.CapabilityEnum.CREATE_AGENTS;
import static com.agentcores.types.enums.CapabilityEnum.CREATE_TASKS;
import static com.agentcores.types.enums.CapabilityEnum.EDIT_AGENTS;
import static com.agentcores.types.enums.CapabilityEnum.EXECUTE_TASKS;
import static com.agentcores.types.enums.CapabilityEnum.INVITE_USERS;
import static com.agentcores.types.enums.CapabilityEnum.MANAGE_ORG_SETTINGS;
import static com.agentcores.types.enums.CapabilityEnum.VIEW_AGENTS;
import static com.agentcores.types.enums.CapabilityEnum.VIEW_AUDIT_LOGS;
import static com.agentcores.types.enums.CapabilityEnum.VIEW_ORG_SETTINGS;
import static com.agentcores.types.enums.CapabilityEnum.VIEW_TASKS;
import static com.agentcores.types.enums.CapabilityEnum.VIEW_USERS;

/**
 * 角色权限表：role -> 能力集合的纯函数。
 * <p>
 * 未列出的角色拒绝一切。表在类加载时构建，之后只读。
 * </p>
 */
public final class PermissionTable {

    private static final Map<UserRoleEnum, Set<CapabilityEnum>> TABLE;

    static {
        Map<UserRoleEnum, Set<CapabilityEnum>> table = new EnumMap<>(UserRoleEnum.class);
        Set<CapabilityEnum> all = EnumSet.allOf(CapabilityEnum.class);
        Set<CapabilityEnum> admin = EnumSet.copyOf(all);
        admin.remove(MANAGE_ORG_SETTINGS);

        table.put(UserRoleEnum.OWNER, all);
        table.put(UserRoleEnum.ADMIN, admin);
        table.put(UserRoleEnum.MANAGER, EnumSet.of(VIEW_AGENTS, CREATE_AGENTS, EDIT_AGENTS,
                VIEW_TASKS, CREATE_TASKS, EXECUTE_TASKS, CANCEL_TASKS,
                VIEW_USERS, INVITE_USERS, VIEW_AUDIT_LOGS, VIEW_ORG_SETTINGS));
        table.put(UserRoleEnum.DEVELOPER, EnumSet.of(VIEW_AGENTS, CREATE_AGENTS, EDIT_AGENTS,
                VIEW_TASKS, CREATE_TASKS, EXECUTE_TASKS, CANCEL_TASKS, VIEW_ORG_SETTINGS));
        table.put(UserRoleEnum.OPERATOR, EnumSet.of(VIEW_AGENTS,
                VIEW_TASKS, EXECUTE_TASKS, CANCEL_TASKS, VIEW_AUDIT_LOGS));
        table.put(UserRoleEnum.ANALYST, EnumSet.of(VIEW_AGENTS, VIEW_TASKS, VIEW_AUDIT_LOGS));
        table.put(UserRoleEnum.VIEWER, EnumSet.of(VIEW_AGENTS, VIEW_TASKS));
        table.put(UserRoleEnum.GUEST, EnumSet.noneOf(CapabilityEnum.class));

        Map<UserRoleEnum, Set<CapabilityEnum>> frozen = new EnumMap<>(UserRoleEnum.class);
        table.forEach((role, capabilities) -> frozen.put(role, Collections.unmodifiableSet(capabilities)));
        TABLE = Collections.unmodifiableMap(frozen);
    }

    private PermissionTable() {
    }

    public static Set<CapabilityEnum> capabilitiesOf(UserRoleEnum role) {
        if (role == null) {
            return Collections.emptySet();
        }
        return TABLE.getOrDefault(role, Collections.emptySet());
    }

    public static boolean holds(UserRoleEnum role, CapabilityEnum capability) {
        return capability != null && capabilitiesOf(role).contains(capability);
    }

    /**
     * 完整权限表的只读视图。
     */
    public static Map<UserRoleEnum, Set<CapabilityEnum>> asMap() {
        return TABLE;
    }
}
