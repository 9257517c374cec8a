package com.collegeportal.backend.modules.auth.application;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.EnumSet;
import java.util.HexFormat;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import com.collegeportal.backend.global.error.ProblemException;
import com.collegeportal.backend.global.error.ValidationProblemException;
import com.collegeportal.backend.modules.auth.domain.PortalRole;
import com.collegeportal.backend.modules.auth.domain.PortalUser;
import com.collegeportal.backend.modules.auth.domain.UserSession;
import com.collegeportal.backend.modules.auth.infrastructure.persistence.PortalUserRepository;
import com.collegeportal.backend.modules.auth.infrastructure.persistence.UserSessionRepository;
import com.collegeportal.backend.modules.auth.presentation.dto.LoginRequest;
import com.collegeportal.backend.modules.auth.presentation.dto.LoginResponse;
import com.collegeportal.backend.modules.auth.presentation.dto.LogoutRequest;
import com.collegeportal.backend.modules.auth.presentation.dto.RefreshRequest;
import com.collegeportal.backend.modules.auth.presentation.dto.RegisterRequest;
import com.collegeportal.backend.modules.auth.presentation.dto.TokenPairResponse;
import com.collegeportal.backend.modules.auth.presentation.dto.UserProfileResponse;
import com.collegeportal.backend.modules.people.domain.PersonProfile;
import com.collegeportal.backend.modules.people.domain.Staff;
import com.collegeportal.backend.modules.people.domain.Student;
import com.collegeportal.backend.modules.people.infrastructure.persistence.StaffRepository;
import com.collegeportal.backend.modules.people.infrastructure.persistence.StudentRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

@Service
@Transactional(noRollbackFor = ResponseStatusException.class)
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private static final String REASON_EXPIRED = "EXPIRED";
    private static final String REASON_ROTATED = "ROTATED";
    private static final String REASON_LOGOUT = "LOGOUT";
    private static final String REASON_USER_INACTIVE = "USER_INACTIVE";

    private final PortalUserRepository portalUserRepository;
    private final UserSessionRepository userSessionRepository;
    private final StudentRepository studentRepository;
    private final StaffRepository staffRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenService jwtTokenService;
    private final Set<PortalRole> selfRegistrationRoles;
    private final Clock clock;

    public AuthService(
            PortalUserRepository portalUserRepository,
            UserSessionRepository userSessionRepository,
            StudentRepository studentRepository,
            StaffRepository staffRepository,
            PasswordEncoder passwordEncoder,
            JwtTokenService jwtTokenService,
            @Value("${app.auth.self-registration-roles:student}") List<String> selfRegistrationRoles,
            Clock clock
    ) {
        this.portalUserRepository = portalUserRepository;
        this.userSessionRepository = userSessionRepository;
        this.studentRepository = studentRepository;
        this.staffRepository = staffRepository;
        this.passwordEncoder = passwordEncoder;
        this.jwtTokenService = jwtTokenService;
        this.selfRegistrationRoles = EnumSet.noneOf(PortalRole.class);
        selfRegistrationRoles.forEach(raw -> this.selfRegistrationRoles.add(PortalRole.fromValue(raw)));
        this.clock = clock;
    }

    public LoginResponse register(RegisterRequest request) {
        if (!request.password().equals(request.passwordConfirm())) {
            throw ValidationProblemException.field("password", "Password fields didn't match.");
        }
        PortalRole role = request.role() != null ? request.role() : PortalRole.STUDENT;
        if (!selfRegistrationRoles.contains(role)) {
            throw ProblemException.forbidden(
                    "auth.registration_role_not_allowed",
                    "Accounts with role '" + role.value() + "' cannot be self-registered."
            );
        }
        if (portalUserRepository.existsByEmailIgnoreCase(request.email())) {
            throw ValidationProblemException.field("email", "A user with this email already exists.");
        }

        PortalUser user = new PortalUser();
        user.setEmail(request.email());
        user.setFirstName(request.firstName().trim());
        user.setLastName(request.lastName().trim());
        user.setPasswordHash(passwordEncoder.encode(request.password()));
        user.setInitialRole(role);
        user.setStaff(role == PortalRole.ADMIN || role == PortalRole.STAFF);
        PortalUser saved = portalUserRepository.save(user);
        log.info("Registered {} account {}", role.value(), saved.getId());

        return issueSession(saved);
    }

    public LoginResponse login(LoginRequest request) {
        PortalUser user = portalUserRepository.findByEmailIgnoreCase(request.email().trim())
                .orElseThrow(() -> new ProblemException(HttpStatus.UNAUTHORIZED, "auth.invalid_credentials", "Invalid credentials."));

        if (!passwordEncoder.matches(request.password(), user.getPasswordHash())) {
            throw new ProblemException(HttpStatus.UNAUTHORIZED, "auth.invalid_credentials", "Invalid credentials.");
        }

        if (!user.isActive()) {
            throw ProblemException.forbidden("auth.user_inactive", "User account is disabled.");
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        userSessionRepository.revokeExpiredSessions(user.getId(), now, REASON_EXPIRED);
        return issueSession(user);
    }

    public LoginResponse refresh(RefreshRequest request) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        UserSession session = userSessionRepository.findByRefreshTokenHash(hash(request.refreshToken()))
                .orElseThrow(() -> new ProblemException(HttpStatus.UNAUTHORIZED, "auth.invalid_refresh_token", "Refresh token is not valid."));

        if (session.getRevokedAt() != null) {
            throw new ProblemException(HttpStatus.UNAUTHORIZED, "auth.invalid_refresh_token", "Refresh token is not valid.");
        }

        if (!session.isUsableAt(now)) {
            session.revoke(now, REASON_EXPIRED);
            throw new ProblemException(HttpStatus.UNAUTHORIZED, "auth.refresh_token_expired", "Refresh token has expired.");
        }

        PortalUser user = session.getUser();
        if (!user.isActive()) {
            session.revoke(now, REASON_USER_INACTIVE);
            throw ProblemException.forbidden("auth.user_inactive", "User account is disabled.");
        }

        // one-time use: the presented token is retired before a new pair is issued
        session.revoke(now, REASON_ROTATED);
        return issueSession(user);
    }

    public void logout(LogoutRequest request) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        userSessionRepository.revokeByRefreshTokenHash(hash(request.refreshToken()), now, REASON_LOGOUT);
    }

    @Transactional(readOnly = true)
    public UserProfileResponse loadProfile(UUID userId) {
        PortalUser user = portalUserRepository.findById(userId)
                .orElseThrow(() -> ProblemException.notFound("auth.user_not_found", "User not found."));
        return buildUserProfile(user);
    }

    private LoginResponse issueSession(PortalUser user) {
        String refreshToken = UUID.randomUUID().toString();
        TokenPairResponse tokens = jwtTokenService.issueTokenPair(user, refreshToken);

        UserSession session = new UserSession();
        session.setUser(user);
        session.setRefreshTokenHash(hash(refreshToken));
        session.setIssuedAt(tokens.issuedAt());
        session.setExpiresAt(tokens.issuedAt().plusSeconds(tokens.refreshExpiresIn()));
        userSessionRepository.save(session);

        return new LoginResponse(tokens, buildUserProfile(user));
    }

    private UserProfileResponse buildUserProfile(PortalUser user) {
        String studentId = null;
        String staffId = null;
        PersonProfile profile = null;
        if (user.getId() != null) {
            Student student = studentRepository.findById(user.getId()).orElse(null);
            Staff staff = staffRepository.findById(user.getId()).orElse(null);
            if (student != null) {
                studentId = student.getStudentId();
                profile = student;
            }
            if (staff != null) {
                staffId = staff.getStaffId();
                profile = staff;
            }
        }
        String department = profile != null && profile.getDepartment() != null
                ? profile.getDepartment().name()
                : null;

        return new UserProfileResponse(
                user.getId(),
                user.getEmail(),
                user.getFirstName(),
                user.getLastName(),
                user.getFullName(),
                user.getRole(),
                user.isActive(),
                user.isStaff(),
                studentId,
                staffId,
                department,
                user.getCreatedAt()
        );
    }

    static String hash(String refreshToken) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(refreshToken.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }
}
