package org.nowstart.lending.service.auth;

import lombok.RequiredArgsConstructor;
import org.nowstart.lending.data.entity.LoanPosition;
import org.nowstart.lending.data.entity.RoleGrant;
import org.nowstart.lending.data.exception.LendingException;
import org.nowstart.lending.data.property.LendingProperties;
import org.nowstart.lending.data.type.LendingErrorCode;
import org.nowstart.lending.data.type.Permission;
import org.nowstart.lending.repository.RoleGrantRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Capability checks performed once at the boundary of each operation.
 */
@Service
@RequiredArgsConstructor
public class AccessControlService {

    private final RoleGrantRepository roleGrantRepository;
    private final LendingProperties lendingProperties;

    public boolean hasPermission(String caller, Permission permission) {
        if (caller == null || caller.isBlank()) {
            return false;
        }
        if (permission == Permission.ADMIN && lendingProperties.admins().contains(caller)) {
            return true;
        }
        if (permission == Permission.LEVERAGE && lendingProperties.leverage().address().equals(caller)) {
            return true;
        }
        return roleGrantRepository.existsById(new RoleGrant.RoleGrantKey(caller, permission));
    }

    public void require(String caller, Permission permission) {
        requireCaller(caller);
        if (!hasPermission(caller, permission)) {
            throw new LendingException(LendingErrorCode.MISSING_ROLE, caller + " lacks role " + permission);
        }
    }

    public void requireOwner(String caller, LoanPosition position) {
        requireCaller(caller);
        if (!position.getOwner().equals(caller)) {
            throw new LendingException(
                    LendingErrorCode.NOT_POSITION_OWNER,
                    caller + " does not own position " + position.getId()
            );
        }
    }

    /**
     * Owner, or a holder of the leverage role acting for the owner.
     */
    public void requireOwnerOrDelegate(String caller, LoanPosition position) {
        requireCaller(caller);
        if (position.getOwner().equals(caller) || hasPermission(caller, Permission.LEVERAGE)) {
            return;
        }
        throw new LendingException(
                LendingErrorCode.NOT_POSITION_OWNER,
                caller + " is neither owner nor delegate of position " + position.getId()
        );
    }

    @Transactional
    public void grant(String account, Permission role, String grantedBy) {
        requireCaller(account);
        RoleGrant.RoleGrantKey key = new RoleGrant.RoleGrantKey(account, role);
        if (!roleGrantRepository.existsById(key)) {
            roleGrantRepository.save(new RoleGrant(key, grantedBy));
        }
    }

    @Transactional
    public boolean revoke(String account, Permission role) {
        RoleGrant.RoleGrantKey key = new RoleGrant.RoleGrantKey(account, role);
        if (!roleGrantRepository.existsById(key)) {
            return false;
        }
        roleGrantRepository.deleteById(key);
        return true;
    }

    private void requireCaller(String caller) {
        if (caller == null || caller.isBlank()) {
            throw new LendingException(LendingErrorCode.INVALID_ADDRESS, "Caller is required");
        }
    }
}
