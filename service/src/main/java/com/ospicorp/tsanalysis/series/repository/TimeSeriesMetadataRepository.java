package com.ospicorp.tsanalysis.series.repository;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface TimeSeriesMetadataRepository extends JpaRepository<TimeSeriesMetadata, String> {

  List<TimeSeriesMetadata> findAllByOrderByCreatedAtAscIdAsc();

  // data points go with it through the FK cascade
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query("DELETE FROM TimeSeriesMetadata m WHERE m.id = :id")
  int deleteMetadataById(@Param("id") String id);
}
