package com.oitracker.mapper;

import com.fasterxml.jackson.core.type.TypeReference;
import com.oitracker.domain.model.TradeSetup;
import com.oitracker.entity.TradeSetupEntity;
import java.util.List;
import java.util.Map;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.MappingTarget;
import org.mapstruct.Named;

/**
 * MapStruct mapper between the TradeSetup domain model and TradeSetupEntity.
 *
 * <p>Fields map 1:1 except the confidence breakdown, which the entity stores as a JSON
 * string. {@link #updateEntity} copies lifecycle changes onto a managed entity.
 */
@Mapper
public interface TradeSetupMapper {

    @Mapping(source = "confidenceBreakdown", target = "confidenceBreakdownJson", qualifiedByName = "breakdownToJson")
    TradeSetupEntity toEntity(TradeSetup tradeSetup);

    @Mapping(source = "confidenceBreakdownJson", target = "confidenceBreakdown", qualifiedByName = "jsonToBreakdown")
    TradeSetup toDomain(TradeSetupEntity entity);

    List<TradeSetup> toDomainList(List<TradeSetupEntity> entities);

    @Mapping(source = "confidenceBreakdown", target = "confidenceBreakdownJson", qualifiedByName = "breakdownToJson")
    void updateEntity(TradeSetup tradeSetup, @MappingTarget TradeSetupEntity entity);

    @Named("breakdownToJson")
    default String breakdownToJson(Map<String, Double> breakdown) {
        return JsonHelper.toJson(breakdown);
    }

    @Named("jsonToBreakdown")
    default Map<String, Double> jsonToBreakdown(String json) {
        return JsonHelper.fromJson(json, new TypeReference<Map<String, Double>>() {});
    }
}
