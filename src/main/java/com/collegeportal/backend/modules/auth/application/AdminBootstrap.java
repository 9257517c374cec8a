package com.collegeportal.backend.modules.auth.application;

import com.collegeportal.backend.modules.auth.domain.PortalRole;
import com.collegeportal.backend.modules.auth.domain.PortalUser;
import com.collegeportal.backend.modules.auth.infrastructure.persistence.PortalUserRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Creates the first administrator when none exists, so a fresh deployment can be managed.
 */
@Component
@ConditionalOnProperty(value = "app.bootstrap.admin.email")
public class AdminBootstrap implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(AdminBootstrap.class);

    private final PortalUserRepository portalUserRepository;
    private final PasswordEncoder passwordEncoder;
    private final String email;
    private final String password;
    private final String firstName;
    private final String lastName;

    public AdminBootstrap(
            PortalUserRepository portalUserRepository,
            PasswordEncoder passwordEncoder,
            @Value("${app.bootstrap.admin.email}") String email,
            @Value("${app.bootstrap.admin.password:}") String password,
            @Value("${app.bootstrap.admin.first-name:Portal}") String firstName,
            @Value("${app.bootstrap.admin.last-name:Administrator}") String lastName
    ) {
        this.portalUserRepository = portalUserRepository;
        this.passwordEncoder = passwordEncoder;
        this.email = email;
        this.password = password;
        this.firstName = firstName;
        this.lastName = lastName;
    }

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        if (portalUserRepository.existsByRole(PortalRole.ADMIN)) {
            return;
        }
        if (password == null || password.isBlank()) {
            log.warn("app.bootstrap.admin.email is set but no password was given; skipping admin bootstrap");
            return;
        }
        if (portalUserRepository.existsByEmailIgnoreCase(email)) {
            log.warn("Bootstrap admin email {} belongs to a non-admin account; skipping", email);
            return;
        }
        PortalUser admin = new PortalUser();
        admin.setEmail(email);
        admin.setFirstName(firstName);
        admin.setLastName(lastName);
        admin.setPasswordHash(passwordEncoder.encode(password));
        admin.setInitialRole(PortalRole.ADMIN);
        admin.setStaff(true);
        portalUserRepository.save(admin);
        log.info("Bootstrapped administrator account {}", admin.getEmail());
    }
}
