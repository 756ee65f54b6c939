package ghnotif.domain.config;

import ghnotif.domain.filter.store.JsonFileFilterStore;
import ghnotif.domain.filter.store.NamedFilterStore;
import ghnotif.domain.json.JsonDeserializer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;

import java.nio.file.Path;

@ApplicationScoped
public class FilterStoreProducer {
    @Produces
    @ApplicationScoped
    public NamedFilterStore produceFilterStore(@FilterPresetsFile final Path file, final JsonDeserializer jsonDeserializer) {
        return new JsonFileFilterStore(file, jsonDeserializer);
    }
}
