package com.collegeportal.backend.modules.auth.application;

import com.collegeportal.backend.modules.auth.domain.PortalRole;
import com.collegeportal.backend.modules.auth.domain.PortalUser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Keeps a user's role in line with the profile attached to it: student profiles imply
 * {@link PortalRole#STUDENT}, staff profiles and department-head appointments imply
 * {@link PortalRole#STAFF}. Invoked explicitly by the services that create or change those records.
 */
@Component
public class ProfileRoleInvariant {

    private static final Logger log = LoggerFactory.getLogger(ProfileRoleInvariant.class);

    /**
     * @return {@code true} when the role was corrected
     */
    public boolean enforce(PortalUser user, PortalRole expected) {
        PortalRole previous = user.getRole();
        boolean corrected = user.assumeRole(expected);
        if (corrected) {
            log.warn("Corrected role of user {} from {} to {}", user.getId(), previous, expected);
        }
        return corrected;
    }
}
