package com.fourpaws.backend.modules.tenant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.fourpaws.backend.global.error.ErrorCode;
import com.fourpaws.backend.global.error.ProblemException;
import com.fourpaws.backend.modules.audit.application.AuditLogService;
import com.fourpaws.backend.modules.tenant.application.OrganizationService;
import com.fourpaws.backend.modules.tenant.application.TenantAuthorizationService;
import com.fourpaws.backend.modules.tenant.domain.Membership;
import com.fourpaws.backend.modules.tenant.domain.MembershipRole;
import com.fourpaws.backend.modules.tenant.domain.Organization;
import com.fourpaws.backend.modules.tenant.domain.ShelterUser;
import com.fourpaws.backend.modules.tenant.infrastructure.persistence.MembershipRepository;
import com.fourpaws.backend.modules.tenant.infrastructure.persistence.OrganizationRepository;
import com.fourpaws.backend.modules.tenant.infrastructure.persistence.ShelterUserRepository;
import com.fourpaws.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class OrganizationServiceTest {

    private static final UUID ORG_ID = UUID.fromString("00000000-0000-0000-0000-0000000000a1");

    @Mock
    private OrganizationRepository organizationRepository;

    @Mock
    private ShelterUserRepository shelterUserRepository;

    @Mock
    private MembershipRepository membershipRepository;

    @Mock
    private TenantAuthorizationService authorizationService;

    @Mock
    private AuditLogService auditLogService;

    private OrganizationService organizationService;
    private ShelterUser admin;

    @BeforeEach
    void setUp() {
        organizationService = new OrganizationService(organizationRepository, shelterUserRepository,
                membershipRepository, authorizationService, auditLogService);
        admin = TestEntities.withId(new ShelterUser(), UUID.randomUUID());
        admin.setEmail("director@example.org");
        lenient().when(organizationRepository.save(any(Organization.class))).thenAnswer(invocation ->
                TestEntities.withId(invocation.<Organization>getArgument(0), ORG_ID));
        lenient().when(membershipRepository.save(any(Membership.class))).thenAnswer(invocation ->
                TestEntities.withId(invocation.<Membership>getArgument(0), UUID.randomUUID()));
    }

    @Test
    void creatorBecomesTheFirstAdmin() {
        when(shelterUserRepository.findById(admin.getId())).thenReturn(Optional.of(admin));

        Organization organization = organizationService.createOrganization(admin.getId(), " Happy Tails ",
                "Happy-Tails", Map.of("timezone", "UTC"));

        assertThat(organization.getName()).isEqualTo("Happy Tails");
        assertThat(organization.getSlug()).isEqualTo("happy-tails");
        ArgumentCaptor<Membership> captor = ArgumentCaptor.forClass(Membership.class);
        verify(membershipRepository).save(captor.capture());
        assertThat(captor.getValue().getRole()).isEqualTo(MembershipRole.ADMIN);
        assertThat(captor.getValue().getOrganizationId()).isEqualTo(ORG_ID);
    }

    @Test
    void duplicateSlugIsRejected() {
        when(shelterUserRepository.findById(admin.getId())).thenReturn(Optional.of(admin));
        when(organizationRepository.existsBySlugIgnoreCase("taken")).thenReturn(true);

        assertThatThrownBy(() -> organizationService.createOrganization(admin.getId(), "X", "taken", null))
                .isInstanceOf(ProblemException.class)
                .satisfies(ex -> assertThat(((ProblemException) ex).hasCode(ErrorCode.DUPLICATE_SLUG)).isTrue());
    }

    @Test
    void lastAdminCannotBeDemoted() {
        Membership only = adminMembership();
        when(membershipRepository.findByUserAndOrganization(admin.getId(), ORG_ID)).thenReturn(Optional.of(only));
        when(membershipRepository.findByOrganizationIdAndRoleForUpdate(ORG_ID, MembershipRole.ADMIN))
                .thenReturn(List.of(only));

        assertThatThrownBy(() -> organizationService.changeRole(ORG_ID, admin.getId(), admin.getId(),
                MembershipRole.STAFF))
                .isInstanceOf(ProblemException.class)
                .satisfies(ex -> assertThat(((ProblemException) ex).hasCode(ErrorCode.LAST_ADMIN)).isTrue());
        assertThat(only.getRole()).isEqualTo(MembershipRole.ADMIN);
    }

    @Test
    void lastAdminCannotBeRemoved() {
        Membership only = adminMembership();
        when(membershipRepository.findByUserAndOrganization(admin.getId(), ORG_ID)).thenReturn(Optional.of(only));
        when(membershipRepository.findByOrganizationIdAndRoleForUpdate(ORG_ID, MembershipRole.ADMIN))
                .thenReturn(List.of(only));

        assertThatThrownBy(() -> organizationService.removeMember(ORG_ID, admin.getId(), admin.getId()))
                .isInstanceOf(ProblemException.class)
                .satisfies(ex -> assertThat(((ProblemException) ex).hasCode(ErrorCode.LAST_ADMIN)).isTrue());
        verify(membershipRepository, never()).delete(any());
    }

    @Test
    void adminCanStepDownWhenAnotherAdminRemains() {
        Membership leaving = adminMembership();
        Membership other = TestEntities.withId(new Membership(), UUID.randomUUID());
        other.setOrganizationId(ORG_ID);
        other.setRole(MembershipRole.ADMIN);
        when(membershipRepository.findByUserAndOrganization(admin.getId(), ORG_ID)).thenReturn(Optional.of(leaving));
        when(membershipRepository.findByOrganizationIdAndRoleForUpdate(ORG_ID, MembershipRole.ADMIN))
                .thenReturn(List.of(leaving, other));

        Membership changed = organizationService.changeRole(ORG_ID, admin.getId(), admin.getId(), MembershipRole.STAFF);

        assertThat(changed.getRole()).isEqualTo(MembershipRole.STAFF);
    }

    private Membership adminMembership() {
        Membership membership = TestEntities.withId(new Membership(), UUID.randomUUID());
        membership.setOrganizationId(ORG_ID);
        membership.setUser(admin);
        membership.setRole(MembershipRole.ADMIN);
        return membership;
    }
}
