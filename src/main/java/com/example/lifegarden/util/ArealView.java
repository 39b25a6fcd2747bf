package com.example.lifegarden.util;

import java.util.List;

public record ArealView(String id,
                        String name,
                        String horizontalPos,
                        String verticalPos,
                        String size,
                        List<PlantStatus> plants) {
}
