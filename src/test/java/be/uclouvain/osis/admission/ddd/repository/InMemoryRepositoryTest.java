package be.uclouvain.osis.admission.ddd.repository;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

class InMemoryRepositoryTest {
  record DossierIdentity(String uuid) implements EntityIdentity {}

  static final class Dossier implements RootEntity<DossierIdentity> {
    private final DossierIdentity entityId;
    private String titre;

    Dossier(final String uuid, final String titre) {
      this.entityId = new DossierIdentity(uuid);
      this.titre = titre;
    }

    @Override
    public DossierIdentity getEntityId() {
      return entityId;
    }
  }

  static final class DossierNonTrouveException extends EntityNotFoundException {
    DossierNonTrouveException(final DossierIdentity entityId) {
      super("Dossier " + entityId.uuid() + " non trouve");
    }
  }

  static final class Dossiers extends InMemoryRepository<DossierIdentity, Dossier> {
    @Override
    protected List<Dossier> fixtures() {
      return List.of(new Dossier("d1", "Premier"), new Dossier("d2", "Second"));
    }

    @Override
    protected EntityNotFoundException notFound(final DossierIdentity entityId) {
      return new DossierNonTrouveException(entityId);
    }

    @Override
    protected Dossier copy(final Dossier entity) {
      return new Dossier(entity.getEntityId().uuid(), entity.titre);
    }
  }

  @Test
  void get_returns_a_copy_and_changes_are_visible_only_after_save() {
    final var dossiers = new Dossiers();
    final var identite = new DossierIdentity("d1");

    final var dossier = dossiers.get(identite);
    dossier.titre = "Modifie";

    assertNotSame(dossiers.get(identite), dossiers.get(identite));
    assertEquals("Premier", dossiers.get(identite).titre);

    dossiers.save(dossier);
    dossier.titre = "Apres sauvegarde";

    assertEquals("Modifie", dossiers.get(identite).titre);
  }

  @Test
  void search_returns_copies() {
    final var dossiers = new Dossiers();

    dossiers.search(List.of()).forEach(dossier -> dossier.titre = "Modifie");

    assertEquals("Premier", dossiers.get(new DossierIdentity("d1")).titre);
    assertEquals("Second", dossiers.get(new DossierIdentity("d2")).titre);
  }

  @Test
  void empty_search_returns_everything_in_insertion_order() {
    final var dossiers = new Dossiers();
    dossiers.save(new Dossier("d3", "Troisieme"));

    assertEquals(
        List.of("d1", "d2", "d3"),
        dossiers.search(List.of()).stream().map(d -> d.getEntityId().uuid()).toList());
    assertEquals(1, dossiers.search(List.of(new DossierIdentity("d2"))).size());
  }

  @Test
  void reset_restores_the_fixtures() {
    final var dossiers = new Dossiers();
    dossiers.delete(new DossierIdentity("d1"));
    final var absent = new DossierIdentity("d1");

    final var exception = assertThrows(DossierNonTrouveException.class, () -> dossiers.get(absent));
    assertEquals(404, exception.getStatusCode());

    dossiers.reset();
    assertEquals("Premier", dossiers.get(absent).titre);
  }

  @Test
  void instances_do_not_share_state() {
    final var premier = new Dossiers();
    final var second = new Dossiers();

    premier.delete(new DossierIdentity("d2"));

    assertEquals(1, premier.search(List.of()).size());
    assertEquals(2, second.search(List.of()).size());
  }

  @Test
  void null_entity_is_rejected() {
    assertThrows(IllegalArgumentException.class, () -> new Dossiers().save(null));
  }
}
