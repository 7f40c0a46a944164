package org.nowstart.lending.data.entity;

import jakarta.persistence.Embeddable;
import jakarta.persistence.EmbeddedId;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.nowstart.lending.data.type.Permission;

import java.io.Serializable;

@Entity
@Table(name = "role_grants")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class RoleGrant extends AuditableEntity {

    @EmbeddedId
    private RoleGrantKey id;

    private String grantedBy;

    @Embeddable
    @Getter
    @Setter
    @NoArgsConstructor(access = AccessLevel.PROTECTED)
    @AllArgsConstructor
    @EqualsAndHashCode
    public static class RoleGrantKey implements Serializable {

        private String account;

        @Enumerated(EnumType.STRING)
        private Permission role;
    }
}
