package com.fourpaws.backend.modules.person.presentation;

import java.util.List;
import java.util.UUID;

import com.fourpaws.backend.global.security.SecurityUtils;
import com.fourpaws.backend.modules.person.application.PersonService;
import com.fourpaws.backend.modules.person.domain.PersonType;
import com.fourpaws.backend.modules.person.presentation.dto.CreatePersonRequest;
import com.fourpaws.backend.modules.person.presentation.dto.PersonResponse;
import com.fourpaws.backend.modules.person.presentation.dto.UpdatePersonRequest;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/organizations/{organizationId}/people")
public class PersonController {

    private final PersonService personService;

    public PersonController(PersonService personService) {
        this.personService = personService;
    }

    @PostMapping
    public ResponseEntity<PersonResponse> createPerson(
            @PathVariable("organizationId") UUID organizationId,
            @Valid @RequestBody CreatePersonRequest request
    ) {
        var person = personService.createPerson(organizationId, SecurityUtils.getCurrentUserId(), request.toCommand());
        return ResponseEntity.status(201).body(PersonResponse.from(person));
    }

    @GetMapping
    public ResponseEntity<List<PersonResponse>> listPeople(
            @PathVariable("organizationId") UUID organizationId,
            @RequestParam(name = "type", required = false) PersonType type
    ) {
        return ResponseEntity.ok(personService.listPeople(organizationId, SecurityUtils.getCurrentUserId(), type)
                .stream()
                .map(PersonResponse::from)
                .toList());
    }

    @GetMapping("/{personId}")
    public ResponseEntity<PersonResponse> getPerson(
            @PathVariable("organizationId") UUID organizationId,
            @PathVariable("personId") UUID personId
    ) {
        return ResponseEntity.ok(PersonResponse.from(
                personService.getPerson(organizationId, SecurityUtils.getCurrentUserId(), personId)));
    }

    @PatchMapping("/{personId}")
    public ResponseEntity<PersonResponse> updatePerson(
            @PathVariable("organizationId") UUID organizationId,
            @PathVariable("personId") UUID personId,
            @Valid @RequestBody UpdatePersonRequest request
    ) {
        var person = personService.updatePerson(organizationId, SecurityUtils.getCurrentUserId(), personId,
                request.toCommand(), request.expectedVersion());
        return ResponseEntity.ok(PersonResponse.from(person));
    }
}
