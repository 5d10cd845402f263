package com.fourpaws.backend.modules.person;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.fourpaws.backend.global.error.ErrorCode;
import com.fourpaws.backend.global.error.ProblemException;
import com.fourpaws.backend.modules.audit.application.AuditLogService;
import com.fourpaws.backend.modules.person.application.PersonService;
import com.fourpaws.backend.modules.person.application.PersonService.PersonCommand;
import com.fourpaws.backend.modules.person.domain.Person;
import com.fourpaws.backend.modules.person.domain.PersonType;
import com.fourpaws.backend.modules.person.infrastructure.persistence.PersonRepository;
import com.fourpaws.backend.modules.tenant.application.TenantAuthorizationService;
import com.fourpaws.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PersonServiceTest {

    private static final UUID ORG_ID = UUID.fromString("00000000-0000-0000-0000-0000000000a1");
    private static final UUID STAFF_ID = UUID.fromString("00000000-0000-0000-0000-0000000000b1");

    @Mock
    private PersonRepository personRepository;

    @Mock
    private TenantAuthorizationService authorizationService;

    @Mock
    private AuditLogService auditLogService;

    private PersonService personService;

    @BeforeEach
    void setUp() {
        personService = new PersonService(personRepository, authorizationService, auditLogService);
        lenient().when(personRepository.save(any(Person.class))).thenAnswer(invocation ->
                TestEntities.withId(invocation.<Person>getArgument(0), UUID.randomUUID()));
    }

    @Test
    void createPersonKeepsTypedFlags() {
        Person person = personService.createPerson(ORG_ID, STAFF_ID, new PersonCommand(PersonType.FOSTER,
                " Lee Park ", "lee@example.org", null, Map.of("available", true, "maxCapacity", 3)));

        assertThat(person.getFullName()).isEqualTo("Lee Park");
        assertThat(person.getFlags()).containsEntry("maxCapacity", 3).containsEntry("available", true);
        assertThat(person.isDoNotAdopt()).isFalse();
    }

    @Test
    void unknownFlagIsRejected() {
        assertThatThrownBy(() -> personService.createPerson(ORG_ID, STAFF_ID, new PersonCommand(PersonType.ADOPTER,
                "A", null, null, Map.of("vip", true))))
                .isInstanceOf(ProblemException.class)
                .satisfies(ex -> assertThat(((ProblemException) ex).hasCode(ErrorCode.INVALID_ATTRIBUTES)).isTrue());
        verify(personRepository, never()).save(any());
    }

    @Test
    void negativeCapacityIsRejected() {
        assertThatThrownBy(() -> personService.createPerson(ORG_ID, STAFF_ID, new PersonCommand(PersonType.FOSTER,
                "B", null, null, Map.of("maxCapacity", -1))))
                .isInstanceOf(ProblemException.class)
                .satisfies(ex -> assertThat(((ProblemException) ex).hasCode(ErrorCode.INVALID_ATTRIBUTES)).isTrue());
    }

    @Test
    void updateReplacesOnlyGivenFields() {
        Person person = TestEntities.withId(new Person(), UUID.randomUUID());
        person.setOrganizationId(ORG_ID);
        person.setType(PersonType.ADOPTER);
        person.setFullName("Robin Vale");
        person.setEmail("robin@example.org");
        when(personRepository.findByIdForUpdate(person.getId(), ORG_ID)).thenReturn(Optional.of(person));

        personService.updatePerson(ORG_ID, STAFF_ID, person.getId(),
                new PersonCommand(null, null, null, "555-0100", Map.of("doNotAdopt", true)), null);

        assertThat(person.getFullName()).isEqualTo("Robin Vale");
        assertThat(person.getEmail()).isEqualTo("robin@example.org");
        assertThat(person.getPhone()).isEqualTo("555-0100");
        assertThat(person.isDoNotAdopt()).isTrue();
    }
}
