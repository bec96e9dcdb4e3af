package com.contract.resolution.registry;

import com.contract.resolution.core.model.Document;
import com.contract.resolution.core.model.DocumentGroup;
import com.contract.resolution.core.model.DocumentOverride;
import com.contract.resolution.core.model.OverrideOrigin;
import com.contract.resolution.core.model.OverrideType;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Proposes overrides implied by the contract structure:
 * Particular over General Conditions, each addendum over the previous one,
 * and the Letter of Acceptance over the Agreement.
 *
 * Proposals never repeat a pair that is already linked. Whether a proposal is cycle-free
 * is left to {@link SnapshotEditor#addOverride}.
 */
public class OverrideInference {

    public List<DocumentOverride> infer(ContractSnapshot snapshot) {
        List<DocumentOverride> proposals = new ArrayList<>();
        List<Document> documents = snapshot.getDocuments();

        List<Document> particular = documents.stream().filter(Document::isParticularConditions).toList();
        List<Document> general = documents.stream().filter(Document::isGeneralConditions).toList();
        for (Document pc : particular) {
            for (Document gc : general) {
                propose(snapshot, proposals, pc, gc, "Particular Conditions prevail over General Conditions");
            }
        }

        List<Document> addendums = documents.stream()
                .filter(d -> d.getGroup() == DocumentGroup.D)
                .sorted(Comparator.comparingInt(Document::getSequence))
                .toList();
        for (int i = 1; i < addendums.size(); i++) {
            propose(snapshot, proposals, addendums.get(i), addendums.get(i - 1),
                    "Later addendum supersedes earlier addendum");
        }

        List<Document> letters = byGroup(documents, DocumentGroup.B);
        List<Document> agreements = byGroup(documents, DocumentGroup.A);
        for (Document letter : letters) {
            for (Document agreement : agreements) {
                propose(snapshot, proposals, letter, agreement, "Letter of Acceptance supplements the Agreement");
            }
        }
        return proposals;
    }

    private static void propose(ContractSnapshot snapshot, List<DocumentOverride> proposals,
                                Document overriding, Document overridden, String reason) {
        if (snapshot.hasOverrideBetween(overriding.getId(), overridden.getId())) {
            return;
        }
        proposals.add(DocumentOverride.builder()
                .id("inferred:" + overriding.getId() + "->" + overridden.getId())
                .overridingDocumentId(overriding.getId())
                .overriddenDocumentId(overridden.getId())
                .overrideType(OverrideType.PARTIAL)
                .scope(overriding.getGroup().name() + " -> " + overridden.getGroup().name())
                .reason(reason)
                .origin(OverrideOrigin.INFERRED)
                .build());
    }

    private static List<Document> byGroup(List<Document> documents, DocumentGroup group) {
        return documents.stream().filter(d -> d.getGroup() == group).toList();
    }
}
