package com.quantori.crp.core.engine;

import com.quantori.crp.api.model.Atom;
import com.quantori.crp.api.model.Element;
import com.quantori.crp.api.model.MolecularGraph;
import com.quantori.crp.api.perception.AromaticRingPerception;
import com.quantori.crp.api.perception.Ring;
import java.util.List;
import lombok.experimental.UtilityClass;

@UtilityClass
public class FeatureAnalyzer {

  public static MoleculeFeatures analyze(MolecularGraph graph) {
    boolean radical = graph.isRadical();
    boolean cyclic = graph.isCyclic();
    List<Ring> aromaticRings = cyclic ? AromaticRingPerception.findAromaticRings(graph) : List.of();
    boolean aromatic = !aromaticRings.isEmpty();

    boolean arylRadical = false;
    if (radical && aromatic) {
      int ringRadicals = graph.getAtoms().stream()
          .filter(atom -> aromaticRings.stream().anyMatch(ring -> ring.containsAtom(atom.getId())))
          .mapToInt(Atom::getRadicalElectrons)
          .sum();
      arylRadical = ringRadicals == graph.getRadicalCount();
    }

    return MoleculeFeatures.builder()
        .radical(radical)
        .cyclic(cyclic)
        .aromatic(aromatic)
        .polycyclicAromatic(aromaticRings.size() > 1)
        .arylRadical(arylRadical)
        .nitrogenValence5(graph.getAtoms().stream()
            .anyMatch(atom -> atom.getElement() == Element.N && graph.getLonePairElectrons(atom.getId()) == 0))
        .lonePairs(graph.getAtoms().stream().anyMatch(atom -> graph.getLonePairElectrons(atom.getId()) > 0))
        .build();
  }
}
