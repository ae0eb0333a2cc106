package com.example.presence.config;

import com.example.presence.entities.Geofence;
import com.example.presence.entities.Student;
import com.example.presence.entities.TimeWindow;
import com.example.presence.geo.GeoJsonPolygonCodec;
import com.example.presence.model.Coordinate;
import com.example.presence.repository.GeofenceRepository;
import com.example.presence.repository.StudentRepository;
import com.example.presence.repository.TimeWindowRepository;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.LocalTime;
import java.util.List;

/**
 * Seeds a demo campus: three students, one geofence and the daily check-in windows.
 * Existing rows are left alone.
 */
@Component
@ConditionalOnProperty(name = "presence.seed-sample-data", havingValue = "true")
public class DataInitializer {

    static final String CAMPUS_NAME = "Campus Principal";

    private final Logger log = LoggerFactory.getLogger(DataInitializer.class);

    private final StudentRepository studentRepo;
    private final GeofenceRepository geofenceRepo;
    private final TimeWindowRepository timeWindowRepo;
    private final GeoJsonPolygonCodec polygonCodec;

    public DataInitializer(StudentRepository studentRepo,
                           GeofenceRepository geofenceRepo,
                           TimeWindowRepository timeWindowRepo,
                           GeoJsonPolygonCodec polygonCodec) {
        this.studentRepo = studentRepo;
        this.geofenceRepo = geofenceRepo;
        this.timeWindowRepo = timeWindowRepo;
        this.polygonCodec = polygonCodec;
    }

    @PostConstruct
    public void init() {
        createStudentIfMissing("STU001", "Dupont", "Jean");
        createStudentIfMissing("STU002", "Martin", "Marie");
        createStudentIfMissing("STU003", "Bernard", "Pierre");

        // Paris, roughly 110 m x 75 m
        createGeofenceIfMissing(CAMPUS_NAME, List.of(
                Coordinate.of(48.8566, 2.3522),
                Coordinate.of(48.8566, 2.3532),
                Coordinate.of(48.8576, 2.3532),
                Coordinate.of(48.8576, 2.3522),
                Coordinate.of(48.8566, 2.3522)), 50);

        if (timeWindowRepo.count() == 0) {
            timeWindowRepo.saveAll(List.of(
                    window("Entrée", LocalTime.of(8, 0), LocalTime.of(8, 30)),
                    window("Pause", LocalTime.of(10, 15), LocalTime.of(10, 30)),
                    window("Sortie", LocalTime.of(17, 0), LocalTime.of(17, 30))));
            log.info("Seeded sample time windows");
        }
    }

    private void createStudentIfMissing(String matricule, String lastName, String firstName) {
        if (studentRepo.findByMatricule(matricule).isEmpty()) {
            Student s = new Student();
            s.setMatricule(matricule);
            s.setLastName(lastName);
            s.setFirstName(firstName);
            s.setActive(true);
            studentRepo.save(s);
            log.info("Seeded student {}", matricule);
        }
    }

    private void createGeofenceIfMissing(String name, List<Coordinate> ring, int marginMeters) {
        if (geofenceRepo.findByName(name).isEmpty()) {
            Geofence g = new Geofence();
            g.setName(name);
            g.setPolygonGeoJson(polygonCodec.write(ring));
            g.setMarginMeters(marginMeters);
            g.setActive(true);
            geofenceRepo.save(g);
            log.info("Seeded geofence '{}' margin={}m", name, marginMeters);
        }
    }

    private static TimeWindow window(String name, LocalTime start, LocalTime end) {
        TimeWindow w = new TimeWindow();
        w.setName(name);
        w.setStartTime(start);
        w.setEndTime(end);
        w.setActive(true);
        return w;
    }
}
