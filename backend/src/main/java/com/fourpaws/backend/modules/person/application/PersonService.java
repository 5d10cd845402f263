package com.fourpaws.backend.modules.person.application;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.fourpaws.backend.global.error.ErrorCode;
import com.fourpaws.backend.global.error.ProblemException;
import com.fourpaws.backend.modules.audit.application.AuditLogService;
import com.fourpaws.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.fourpaws.backend.modules.audit.application.AuditSnapshot;
import com.fourpaws.backend.modules.audit.domain.AuditAction;
import com.fourpaws.backend.modules.person.domain.Person;
import com.fourpaws.backend.modules.person.domain.PersonFlags;
import com.fourpaws.backend.modules.person.domain.PersonType;
import com.fourpaws.backend.modules.person.infrastructure.persistence.PersonRepository;
import com.fourpaws.backend.modules.tenant.application.TenantAuthorizationService;
import com.fourpaws.backend.modules.tenant.domain.MembershipRole;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class PersonService {

    private static final String ENTITY_PERSON = "PERSON";

    private final PersonRepository personRepository;
    private final TenantAuthorizationService authorizationService;
    private final AuditLogService auditLogService;

    public PersonService(
            PersonRepository personRepository,
            TenantAuthorizationService authorizationService,
            AuditLogService auditLogService
    ) {
        this.personRepository = personRepository;
        this.authorizationService = authorizationService;
        this.auditLogService = auditLogService;
    }

    public Person createPerson(UUID organizationId, UUID actorId, PersonCommand command) {
        authorizationService.requireRole(actorId, organizationId, MembershipRole.STAFF);
        Person person = new Person();
        person.setOrganizationId(organizationId);
        person.setType(command.type());
        person.setFullName(command.fullName().trim());
        person.setEmail(command.email());
        person.setPhone(command.phone());
        person.setFlags(validateFlags(command.flags()));
        Person saved = personRepository.save(person);

        auditLogService.record(AuditLogCommand.created(organizationId, actorId, AuditAction.PERSON_CREATED,
                ENTITY_PERSON, saved.getId(), snapshot(saved)));
        return saved;
    }

    /**
     * Replaces the non-null fields of the command. Flags, when given, replace the whole map.
     */
    public Person updatePerson(UUID organizationId, UUID actorId, UUID personId, PersonCommand command,
                               Long expectedVersion) {
        authorizationService.requireRole(actorId, organizationId, MembershipRole.STAFF);
        Person person = personRepository.findByIdForUpdate(personId, organizationId)
                .orElseThrow(() -> ProblemException.unknownEntity("Person"));
        person.checkVersion(expectedVersion, ENTITY_PERSON);

        Map<String, Object> before = snapshot(person);
        if (command.type() != null) {
            person.setType(command.type());
        }
        if (command.fullName() != null) {
            person.setFullName(command.fullName().trim());
        }
        if (command.email() != null) {
            person.setEmail(command.email());
        }
        if (command.phone() != null) {
            person.setPhone(command.phone());
        }
        if (command.flags() != null) {
            person.setFlags(validateFlags(command.flags()));
        }

        auditLogService.record(new AuditLogCommand(organizationId, actorId, AuditAction.PERSON_UPDATED,
                ENTITY_PERSON, person.getId(), before, snapshot(person)));
        return person;
    }

    @Transactional(readOnly = true)
    public Person getPerson(UUID organizationId, UUID actorId, UUID personId) {
        authorizationService.requireRole(actorId, organizationId, MembershipRole.READONLY);
        return requirePerson(organizationId, personId);
    }

    @Transactional(readOnly = true)
    public List<Person> listPeople(UUID organizationId, UUID actorId, PersonType type) {
        authorizationService.requireRole(actorId, organizationId, MembershipRole.READONLY);
        if (type == null) {
            return personRepository.findByOrganizationIdOrderByFullNameAsc(organizationId);
        }
        return personRepository.findByOrganizationIdAndTypeOrderByFullNameAsc(organizationId, type);
    }

    @Transactional(readOnly = true)
    public Person requirePerson(UUID organizationId, UUID personId) {
        return personRepository.findByIdAndOrganizationId(personId, organizationId)
                .orElseThrow(() -> ProblemException.unknownEntity("Person"));
    }

    private Map<String, Object> validateFlags(Map<String, Object> flags) {
        Map<String, Object> validated = PersonFlags.SCHEMA.validate(flags);
        Object capacity = validated.get(PersonFlags.MAX_CAPACITY);
        if (capacity instanceof Number number && number.longValue() < 0) {
            throw new ProblemException(ErrorCode.INVALID_ATTRIBUTES, "flags: 'maxCapacity' must not be negative");
        }
        return validated;
    }

    private static Map<String, Object> snapshot(Person person) {
        return AuditSnapshot.of(
                "type", person.getType(),
                "fullName", person.getFullName(),
                "email", person.getEmail(),
                "phone", person.getPhone(),
                "flags", person.getFlags()
        );
    }

    public record PersonCommand(
            PersonType type,
            String fullName,
            String email,
            String phone,
            Map<String, Object> flags
    ) {
    }
}
