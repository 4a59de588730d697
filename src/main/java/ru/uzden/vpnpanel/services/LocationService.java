package ru.uzden.vpnpanel.services;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import ru.uzden.vpnpanel.entities.Location;
import ru.uzden.vpnpanel.exceptions.NotFoundException;
import ru.uzden.vpnpanel.exceptions.ServiceException;
import ru.uzden.vpnpanel.repositories.LocationRepository;
import ru.uzden.vpnpanel.repositories.PanelRepository;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class LocationService {

    private final LocationRepository locationRepository;
    private final PanelRepository panelRepository;

    @Transactional
    public Location createLocation(String name, String flag) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name is required");
        }
        String n = name.trim();
        if (locationRepository.existsByName(n)) {
            throw new ServiceException("Location " + n + " already exists");
        }
        Location location = new Location();
        location.setName(n);
        location.setFlag(flag == null || flag.isBlank() ? null : flag.trim());
        Location saved = locationRepository.save(location);
        log.info("Location {} created: {}", saved.getId(), n);
        return saved;
    }

    @Transactional(readOnly = true)
    public List<Location> listLocations() {
        return locationRepository.findAllByOrderByNameAsc();
    }

    /**
     * Локацию нельзя удалить, пока на неё ссылается хоть одна панель, активная или нет.
     */
    @Transactional
    public void deleteLocation(long locationId) {
        Location location = locationRepository.findById(locationId)
                .orElseThrow(() -> new NotFoundException("Location " + locationId + " not found"));

        long active = panelRepository.countByLocationIdAndActiveTrue(locationId);
        if (active > 0) {
            throw new ServiceException("Location " + locationId + " is used by " + active + " active panels");
        }
        long any = panelRepository.countByLocationId(locationId);
        if (any > 0) {
            throw new ServiceException("Location " + locationId + " is still referenced by " + any + " inactive panels");
        }
        locationRepository.delete(location);
        log.info("Location {} deleted", locationId);
    }
}
