package com.questhub.combatservice.combat.domain.document;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class UserDocument {
    private String id;
    /** 全局唯一的登录名 */
    private String handle;
    private long createdAt;
}
