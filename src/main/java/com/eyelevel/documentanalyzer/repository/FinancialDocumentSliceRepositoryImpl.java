package com.eyelevel.documentanalyzer.repository;

import com.eyelevel.documentanalyzer.model.FinancialDocument;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

public class FinancialDocumentSliceRepositoryImpl implements FinancialDocumentSliceRepository {

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    @Transactional(readOnly = true)
    public List<FinancialDocument> findSlice(final int offset, final int limit) {
        return entityManager.createNamedQuery("FinancialDocument.findAllOrderedById", FinancialDocument.class)
                            .setFirstResult(offset)
                            .setMaxResults(limit)
                            .getResultList();
    }
}
