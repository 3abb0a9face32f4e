package com.gocomet.rideadmin.ride.repository;

import com.gocomet.rideadmin.ride.model.GeoPoint;
import com.gocomet.rideadmin.ride.model.Ride;
import com.gocomet.rideadmin.ride.model.RideOrdering;
import com.gocomet.rideadmin.ride.model.RideSearchCriteria;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.TypedQuery;
import jakarta.persistence.criteria.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.support.PageableExecutionUtils;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

/**
 * Criteria implementation of {@link RideSearchRepository}.
 *
 * <p>Distance ordering uses the squared planar distance
 * {@code (pickup_latitude - lat)^2 + (pickup_longitude - lng)^2}, evaluated by
 * the database so it can sort and paginate without loading the table. It is
 * not a geodesic distance and is wrong near the poles and across the
 * antimeridian.
 */
@Slf4j
@Transactional(readOnly = true)
public class RideSearchRepositoryImpl implements RideSearchRepository {

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public Page<Ride> search(RideSearchCriteria criteria) {
        Pageable pageable = PageRequest.of(criteria.getPage() - 1, criteria.getPageSize());
        CriteriaBuilder cb = entityManager.getCriteriaBuilder();

        CriteriaQuery<Ride> query = cb.createQuery(Ride.class);
        Root<Ride> ride = query.from(Ride.class);
        ride.fetch("rider", JoinType.LEFT);
        ride.fetch("driver", JoinType.LEFT);
        query.select(ride)
                .where(filters(cb, ride, criteria))
                .orderBy(orders(cb, ride, criteria));

        TypedQuery<Ride> pageQuery = entityManager.createQuery(query)
                .setFirstResult(Math.toIntExact(pageable.getOffset()))
                .setMaxResults(pageable.getPageSize());
        List<Ride> content = pageQuery.getResultList();
        log.debug("Ride search {} returned {} rows", criteria, content.size());

        return PageableExecutionUtils.getPage(content, pageable, () -> count(cb, criteria));
    }

    private long count(CriteriaBuilder cb, RideSearchCriteria criteria) {
        CriteriaQuery<Long> query = cb.createQuery(Long.class);
        Root<Ride> ride = query.from(Ride.class);
        query.select(cb.count(ride)).where(filters(cb, ride, criteria));
        return entityManager.createQuery(query).getSingleResult();
    }

    private Predicate[] filters(CriteriaBuilder cb, Root<Ride> ride, RideSearchCriteria criteria) {
        List<Predicate> predicates = new ArrayList<>();
        if (criteria.getStatus() != null) {
            predicates.add(cb.equal(ride.get("status"), criteria.getStatus()));
        }
        if (criteria.getRiderEmail() != null) {
            // Inner join: rides without a rider never match an email filter.
            Join<Object, Object> rider = ride.join("rider", JoinType.INNER);
            predicates.add(cb.equal(rider.get("email"), criteria.getRiderEmail()));
        }
        return predicates.toArray(new Predicate[0]);
    }

    private List<Order> orders(CriteriaBuilder cb, Root<Ride> ride, RideSearchCriteria criteria) {
        List<Order> orders = new ArrayList<>();
        RideOrdering ordering = criteria.getOrdering();
        if (ordering != null) {
            Expression<?> key = switch (ordering.getField()) {
                case PICKUP_TIME -> ride.get("pickupTime");
                case DISTANCE -> squaredDistance(cb, ride, criteria.getOrigin());
            };
            orders.add(ordering.isDescending() ? cb.desc(key) : cb.asc(key));
        }
        // Tie-break keeps pagination stable when the primary key has duplicates.
        orders.add(cb.asc(ride.get("id")));
        return orders;
    }

    private Expression<Double> squaredDistance(CriteriaBuilder cb, Root<Ride> ride, GeoPoint origin) {
        Expression<Double> latDiff = cb.diff(ride.<Double>get("pickupLatitude"), origin.getLatitude());
        Expression<Double> lngDiff = cb.diff(ride.<Double>get("pickupLongitude"), origin.getLongitude());
        return cb.sum(cb.prod(latDiff, latDiff), cb.prod(lngDiff, lngDiff));
    }
}
