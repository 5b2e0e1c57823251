package bio.treeio.cli;

import bio.treeio.config.OrderBy;
import picocli.CommandLine;

public class OrderByConverter implements CommandLine.ITypeConverter<OrderBy> {

    @Override
    public OrderBy convert(String value) {
        return OrderBy.from(value);
    }
}
