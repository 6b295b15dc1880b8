package com.example.PMS.Repositories;

import com.example.PMS.DTO.SpotSearchCriteria;
import com.example.PMS.DTO.StatusBucket;
import com.example.PMS.Entities.ParkingSpot;
import com.example.PMS.Entities.SpotStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.aggregation.AggregationResults;
import org.springframework.data.mongodb.core.aggregation.ConditionalOperators;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

public class ParkingSpotRepositoryCustomImpl implements ParkingSpotRepositoryCustom {

    @Autowired
    private MongoTemplate mongoTemplate;

    @Override
    public List<ParkingSpot> search(SpotSearchCriteria criteria) {
        Query query = new Query();

        if (StringUtils.hasText(criteria.getStatus())) {
            query.addCriteria(Criteria.where("status").is(criteria.getStatus()));
        }
        if (StringUtils.hasText(criteria.getSpotType())) {
            query.addCriteria(Criteria.where("spotType").is(criteria.getSpotType()));
        }
        if (StringUtils.hasText(criteria.getSearch())) {
            // Literal substring, not a user-supplied regex
            String pattern = Pattern.quote(criteria.getSearch());
            query.addCriteria(new Criteria().orOperator(
                    Criteria.where("spotNumber").regex(pattern, "i"),
                    Criteria.where("vehicleLicense").regex(pattern, "i")));
        }

        query.with(Sort.by(Sort.Direction.ASC, "spotNumber"));
        return mongoTemplate.find(query, ParkingSpot.class);
    }

    @Override
    public Optional<ParkingSpot> updateFields(String id, Map<String, Object> fields) {
        Update update = new Update();
        fields.forEach(update::set);

        ParkingSpot updated = mongoTemplate.findAndModify(
                Query.query(Criteria.where("id").is(id)),
                update,
                FindAndModifyOptions.options().returnNew(true),
                ParkingSpot.class);
        return Optional.ofNullable(updated);
    }

    @Override
    public Optional<ParkingSpot> transition(String id, String expectedStatus, Update update) {
        Query query = Query.query(Criteria.where("id").is(id).and("status").is(expectedStatus));

        ParkingSpot updated = mongoTemplate.findAndModify(
                query,
                update,
                FindAndModifyOptions.options().returnNew(true),
                ParkingSpot.class);
        return Optional.ofNullable(updated);
    }

    @Override
    public boolean removeById(String id) {
        return mongoTemplate.remove(Query.query(Criteria.where("id").is(id)), ParkingSpot.class)
                .getDeletedCount() > 0;
    }

    @Override
    public List<StatusBucket> aggregateByStatus() {
        Aggregation aggregation = Aggregation.newAggregation(
                Aggregation.group("status")
                        .count().as("count")
                        .sum(ConditionalOperators
                                .when(Criteria.where("status").is(SpotStatus.OCCUPIED.getValue()))
                                .thenValueOf("hourlyRate")
                                .otherwise(0))
                        .as("revenue"));

        AggregationResults<StatusBucket> results = mongoTemplate.aggregate(aggregation, ParkingSpot.class,
                StatusBucket.class);
        return results.getMappedResults();
    }
}
