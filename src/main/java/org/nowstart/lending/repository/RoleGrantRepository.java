package org.nowstart.lending.repository;

import org.nowstart.lending.data.entity.RoleGrant;
import org.springframework.data.jpa.repository.JpaRepository;

public interface RoleGrantRepository extends JpaRepository<RoleGrant, RoleGrant.RoleGrantKey> {
}
