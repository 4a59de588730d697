package ru.uzden.vpnpanel.controllers;

import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import ru.uzden.vpnpanel.services.LocationService;

import java.util.List;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/admin/locations")
public class AdminLocationController {

    private final LocationService locationService;

    @GetMapping
    public List<AdminViews.LocationView> list() {
        return locationService.listLocations().stream().map(AdminViews.LocationView::of).toList();
    }

    @PostMapping
    public ResponseEntity<AdminViews.LocationView> create(@RequestBody AdminViews.LocationRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(AdminViews.LocationView.of(locationService.createLocation(request.name(), request.flag())));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable("id") long id) {
        locationService.deleteLocation(id);
        return ResponseEntity.noContent().build();
    }
}
