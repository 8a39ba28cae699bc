package com.consular.network.controller;

import com.consular.network.model.AffiliationView;
import com.consular.network.model.PersonNetworkGraph;
import com.consular.network.service.NetworkExplorationService;
import com.consular.network.service.OrganizationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/people")
@Tag(name = "People", description = "Per-person network and affiliations")
public class PersonController {

    private final NetworkExplorationService explorationService;
    private final OrganizationService organizationService;

    public PersonController(NetworkExplorationService explorationService,
                            OrganizationService organizationService) {
        this.explorationService = explorationService;
        this.organizationService = organizationService;
    }

    @GetMapping("/{personId}/network")
    @Operation(summary = "Get a person's ego network",
               description = "The person, their active organizations and the other active members, with membership edges")
    public ResponseEntity<PersonNetworkGraph> getPersonNetwork(
            @Parameter(description = "Person ID", example = "PER-0001")
            @PathVariable String personId) {
        PersonNetworkGraph graph = explorationService.getPersonNetwork(personId);
        if (graph == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(graph);
    }

    @GetMapping("/{personId}/organizations")
    @Operation(summary = "List a person's organizations",
               description = "Memberships of the person with organization name, risk tier and city")
    public ResponseEntity<List<AffiliationView>> getPersonOrganizations(
            @Parameter(description = "Person ID", example = "PER-0001")
            @PathVariable String personId,
            @Parameter(description = "Only active memberships")
            @RequestParam(defaultValue = "false") boolean activeOnly) {
        List<AffiliationView> affiliations = organizationService.getPersonOrganizations(personId, activeOnly);
        if (affiliations == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(affiliations);
    }
}
