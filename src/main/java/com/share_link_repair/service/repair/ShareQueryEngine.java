package com.share_link_repair.service.repair;

import com.share_link_repair.dto.share.AffectedShare;
import com.share_link_repair.entity.Share;
import com.share_link_repair.specification.ShareSpecification;
import jakarta.persistence.EntityManager;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Root;
import jakarta.persistence.criteria.Subquery;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.hibernate.jpa.HibernateHints;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.stream.Stream;

/**
 * Finds link shares whose parent is a user or group share on the same item.
 * Both queries share {@link ShareSpecification#unsafeChain}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ShareQueryEngine {

    private static final int FETCH_SIZE = 500;

    private final EntityManager entityManager;

    @Transactional(readOnly = true)
    public int countAffected() {
        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        CriteriaQuery<Long> query = cb.createQuery(Long.class);
        Root<Share> share = query.from(Share.class);

        Subquery<Integer> unsafeIds = query.subquery(Integer.class);
        Root<Share> s1 = unsafeIds.from(Share.class);
        Root<Share> s2 = unsafeIds.from(Share.class);
        unsafeIds.select(s1.<Integer>get("id"))
                .where(ShareSpecification.unsafeChain(s1, s2, query, cb));

        query.select(cb.count(share))
                .where(share.<Integer>get("id").in(unsafeIds));

        Long total = entityManager.createQuery(query).getSingleResult();
        log.debug("Found {} over exposing link shares", total);
        return total == null ? 0 : Math.toIntExact(total);
    }

    /**
     * Lazily fetched rows. The caller must close the stream and keep a transaction
     * open while consuming it.
     */
    @Transactional(propagation = Propagation.MANDATORY, readOnly = true)
    public Stream<AffectedShare> streamAffected() {
        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        CriteriaQuery<AffectedShare> query = cb.createQuery(AffectedShare.class);
        Root<Share> s1 = query.from(Share.class);
        Root<Share> s2 = query.from(Share.class);

        query.select(cb.construct(AffectedShare.class,
                        s1.<Integer>get("id"),
                        s1.<String>get("uidOwner"),
                        s1.<String>get("uidInitiator")))
                .where(ShareSpecification.unsafeChain(s1, s2, query, cb))
                .orderBy(cb.asc(s1.get("id")));

        return entityManager.createQuery(query)
                .setHint(HibernateHints.HINT_FETCH_SIZE, FETCH_SIZE)
                .getResultStream();
    }
}
